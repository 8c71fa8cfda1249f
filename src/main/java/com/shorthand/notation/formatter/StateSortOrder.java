package com.shorthand.notation.formatter;

/**
 * Order in which an entity's state variables are written.
 */
public enum StateSortOrder {
    /** Original source order. */
    LOCATION,
    /** Lexical order by variable name. */
    NAME,
    /** Order of the document's lists, untouched. */
    NONE
}
