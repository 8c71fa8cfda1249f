package com.shorthand.notation.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A typed attribute, written {@code pos ∈ f32[N]@GPU}.
 */
@Value
@Builder
public class StateVariable {
    @NonNull
    String name;

    @NonNull
    TypeSpec typeSpec;

    @EqualsAndHashCode.Exclude
    int sourceLine;
}
