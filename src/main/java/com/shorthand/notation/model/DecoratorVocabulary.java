package com.shorthand.notation.model;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.NonNull;
import lombok.Value;

/**
 * Allow-list of names recognized as decorator tags, e.g. {@code [Prop]} or
 * {@code [Cached:TTL:60]}. Names outside the list classify as operation tags
 * when parsed, and downgrade to {@link TagType#CUSTOM} when a decorator tag is
 * built directly.
 */
@Value
public class DecoratorVocabulary {

    public static final DecoratorVocabulary DEFAULT = of(
            "Prop", "Static", "Class", "Abstract", "Cached", "RateLimit",
            "Auth", "Retry", "Timeout", "Deprecated");

    @NonNull
    Set<String> names;

    public static DecoratorVocabulary of(String... names) {
        return new DecoratorVocabulary(Set.copyOf(Arrays.asList(names)));
    }

    public boolean contains(String name) {
        return name != null && names.contains(name);
    }

    /**
     * Returns a vocabulary holding these names plus the extra ones.
     */
    public DecoratorVocabulary with(String... extra) {
        Set<String> merged = new LinkedHashSet<>(names);
        merged.addAll(Arrays.asList(extra));
        return new DecoratorVocabulary(Set.copyOf(merged));
    }
}
