package com.shorthand.notation.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A non-fatal observation made while parsing.
 */
@Value
public class Diagnostic {
    @NonNull
    Severity severity;
    int line;
    int column;
    @NonNull
    String message;

    @Override
    public String toString() {
        return severity + " line " + line + ":" + column + ": " + message;
    }
}
