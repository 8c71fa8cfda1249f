package com.shorthand.notation.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A dependency of an entity on another entity, written {@code ◊ [Ref:Name]}.
 * The target is kept by name only and never resolved.
 */
@Value
@Builder
public class Reference {
    @NonNull
    String name;

    @EqualsAndHashCode.Exclude
    int sourceLine;
}
