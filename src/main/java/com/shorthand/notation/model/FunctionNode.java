package com.shorthand.notation.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A function signature line, {@code F:name(p: T) → R [tag]...}.
 */
@Value
@Builder
public class FunctionNode {
    @NonNull
    String name;

    @Singular
    List<Parameter> parameters;

    @NonNull
    @Builder.Default
    TypeSpec returnType = TypeSpec.UNKNOWN;

    @Singular
    List<Tag> tags;

    @EqualsAndHashCode.Exclude
    int sourceLine;

    /**
     * First complexity found on any tag, in tag order.
     */
    public Optional<String> getComplexity() {
        return tags.stream()
                .map(Tag::getComplexity)
                .flatMap(Optional::stream)
                .findFirst();
    }

    public Optional<Tag> getHttpRoute() {
        return tags.stream().filter(Tag::isHttpRoute).findFirst();
    }

    public boolean hasDecorator(String name) {
        return tags.stream().anyMatch(t -> t.isDecorator() && t.getBase().equals(name));
    }
}
