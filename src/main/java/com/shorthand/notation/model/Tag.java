package com.shorthand.notation.model;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * A bracketed annotation such as {@code [Lin:MatMul:O(N*D)]}, {@code [O(N)]},
 * {@code [Prop]} or {@code [GET/users/{id}]}.
 *
 * Instances are validated on construction and compare by value. A decorator
 * tag whose base is not in the vocabulary is stored as {@link TagType#CUSTOM}.
 */
@Value
public class Tag {

    public static final Set<String> HTTP_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH");

    String base;
    List<String> qualifiers;
    TagType tagType;
    String httpMethod;
    String httpPath;

    @Builder
    public Tag(String base, List<String> qualifiers, TagType tagType, String httpMethod, String httpPath,
               DecoratorVocabulary vocabulary) {
        if (base == null || base.isEmpty()) {
            throw new IllegalArgumentException("Tag base must not be empty");
        }
        List<String> copied = qualifiers == null ? List.of() : List.copyOf(qualifiers);
        if (copied.stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("Tag qualifiers must not be empty: '" + base + "'");
        }

        TagType type = tagType == null ? TagType.OPERATION : tagType;

        if (type == TagType.COMPLEXITY && !isComplexityNotation(base)) {
            throw new IllegalArgumentException("Invalid complexity notation: '" + base + "'");
        }

        if (type == TagType.HTTP_ROUTE) {
            if (httpMethod == null || httpPath == null) {
                throw new IllegalArgumentException("HTTP route tag must have both http_method and http_path");
            }
            if (!HTTP_METHODS.contains(httpMethod)) {
                throw new IllegalArgumentException("Invalid HTTP method: '" + httpMethod + "'");
            }
            if (!httpPath.startsWith("/")) {
                throw new IllegalArgumentException("HTTP path must start with '/': '" + httpPath + "'");
            }
        }

        DecoratorVocabulary known = vocabulary == null ? DecoratorVocabulary.DEFAULT : vocabulary;
        if (type == TagType.DECORATOR && !known.contains(base)) {
            type = TagType.CUSTOM;
        }

        this.base = base;
        this.qualifiers = copied;
        this.tagType = type;
        this.httpMethod = type == TagType.HTTP_ROUTE ? httpMethod : null;
        this.httpPath = type == TagType.HTTP_ROUTE ? httpPath : null;
    }

    /**
     * True for {@code O(} + a non-empty, balanced expression + {@code )}.
     */
    public static boolean isComplexityNotation(String text) {
        if (text == null || text.length() < 4 || !text.startsWith("O(") || !text.endsWith(")")) {
            return false;
        }
        String inner = text.substring(2, text.length() - 1);
        if (inner.isBlank()) {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    public boolean isOperation() {
        return tagType == TagType.OPERATION;
    }

    public boolean isComplexity() {
        return tagType == TagType.COMPLEXITY;
    }

    public boolean isDecorator() {
        return tagType == TagType.DECORATOR;
    }

    public boolean isHttpRoute() {
        return tagType == TagType.HTTP_ROUTE;
    }

    public boolean isIo() {
        return "IO".equals(base);
    }

    public boolean isSync() {
        return "Sync".equals(base);
    }

    /**
     * The complexity carried by this tag: the base of a complexity tag, else
     * the first qualifier written in {@code O(...)} form.
     */
    public Optional<String> getComplexity() {
        if (isComplexity()) {
            return Optional.of(base);
        }
        return qualifiers.stream().filter(Tag::isComplexityNotation).findFirst();
    }

    /**
     * Canonical text of the tag.
     */
    @Override
    public String toString() {
        if (isHttpRoute()) {
            return "[" + httpMethod + httpPath + "]";
        }
        StringBuilder sb = new StringBuilder("[").append(base);
        for (String qualifier : qualifiers) {
            sb.append(':').append(qualifier);
        }
        return sb.append(']').toString();
    }
}
