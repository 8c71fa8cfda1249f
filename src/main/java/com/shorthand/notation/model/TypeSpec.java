package com.shorthand.notation.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A type as written in the notation: base name, optional symbolic shape and
 * optional placement, e.g. {@code f32[B,N,D]@GPU}.
 *
 * Base names are opaque; no checking is done against any type system.
 */
@Value
@Builder(toBuilder = true)
public class TypeSpec {

    public static final String UNKNOWN_NAME = "Unknown";

    /** Sentinel for a type that could not be resolved. */
    public static final TypeSpec UNKNOWN = TypeSpec.of(UNKNOWN_NAME);

    @NonNull
    String baseType;

    /** Symbolic dimensions; empty when the type has no shape. */
    @NonNull
    @Builder.Default
    List<String> shape = List.of();

    /** Null when no placement was written. */
    Placement placement;

    public static TypeSpec of(String baseType) {
        return TypeSpec.builder().baseType(baseType).build();
    }

    public boolean hasShape() {
        return !shape.isEmpty();
    }

    public boolean isUnknown() {
        return UNKNOWN_NAME.equals(baseType) && shape.isEmpty() && placement == null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(baseType);
        if (hasShape()) {
            sb.append('[').append(String.join(",", shape)).append(']');
        }
        if (placement != null) {
            sb.append('@').append(placement.name());
        }
        return sb.toString();
    }
}
