package com.shorthand.notation.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Execution or storage location written after {@code @} in a type, as in
 * {@code f32[N]@GPU}.
 */
public enum Placement {
    GPU,
    CPU,
    TPU,
    DISK,
    NET;

    public static Optional<Placement> fromNotation(String name) {
        return Arrays.stream(values())
                .filter(p -> p.name().equals(name))
                .findFirst();
    }
}
