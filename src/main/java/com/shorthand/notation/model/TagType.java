package com.shorthand.notation.model;

/**
 * The closed set of tag variants.
 */
public enum TagType {
    OPERATION,
    COMPLEXITY,
    DECORATOR,
    HTTP_ROUTE,
    CUSTOM
}
