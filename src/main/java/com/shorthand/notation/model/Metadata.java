package com.shorthand.notation.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Module header taken from {@code # [M:Name] [Role:Role]}. Role may be null.
 */
@Value
public class Metadata {
    @NonNull
    String moduleName;

    String role;
}
