package com.shorthand.notation.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A class-like unit opened by {@code [C:Name]}, holding its dependencies and
 * state variables in source order.
 */
@Value
@Builder
public class EntityNode {
    @NonNull
    String name;

    @Singular
    List<Reference> dependencies;

    @Singular("stateVariable")
    List<StateVariable> state;

    @EqualsAndHashCode.Exclude
    int sourceLine;

    public Optional<StateVariable> findState(String variableName) {
        return state.stream()
                .filter(v -> v.getName().equals(variableName))
                .findFirst();
    }
}
