package com.shorthand.notation.parser;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.shorthand.notation.model.DecoratorVocabulary;
import com.shorthand.notation.model.Tag;
import com.shorthand.notation.model.TagType;

/**
 * Decides which variant a bracketed tag is, from its raw content and its
 * colon-separated fragments.
 *
 * Order: complexity, HTTP route, decorator, operation. Invariant violations
 * surface as {@link IllegalArgumentException} from {@link Tag}.
 */
public class TagClassifier {

    // Method keyword immediately followed by the path; no space, no colon
    private static final Pattern HTTP_ROUTE = Pattern.compile("^(GET|POST|PUT|DELETE|PATCH)(/.*)$");

    private final DecoratorVocabulary vocabulary;

    public TagClassifier() {
        this(DecoratorVocabulary.DEFAULT);
    }

    public TagClassifier(DecoratorVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Classify tag content given without its brackets, e.g. {@code Lin:MatMul}.
     */
    public Tag classify(String content) {
        List<String> fragments = Arrays.stream(content.split(":", -1))
                .map(String::trim)
                .toList();
        return classify(content, fragments);
    }

    public Tag classify(String rawContent, List<String> fragments) {
        String first = fragments.isEmpty() ? "" : fragments.get(0);

        if (first.startsWith("O(")) {
            return Tag.builder()
                    .base(first)
                    .tagType(TagType.COMPLEXITY)
                    .vocabulary(vocabulary)
                    .build();
        }

        Matcher route = HTTP_ROUTE.matcher(rawContent.trim());
        if (route.matches()) {
            return Tag.builder()
                    .base(route.group(1) + route.group(2))
                    .tagType(TagType.HTTP_ROUTE)
                    .httpMethod(route.group(1))
                    .httpPath(route.group(2))
                    .vocabulary(vocabulary)
                    .build();
        }

        List<String> qualifiers = fragments.subList(Math.min(1, fragments.size()), fragments.size());
        TagType type = vocabulary.contains(first) ? TagType.DECORATOR : TagType.OPERATION;

        return Tag.builder()
                .base(first)
                .qualifiers(qualifiers)
                .tagType(type)
                .vocabulary(vocabulary)
                .build();
    }
}
