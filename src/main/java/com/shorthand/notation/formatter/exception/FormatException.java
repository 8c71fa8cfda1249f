package com.shorthand.notation.formatter.exception;

import java.util.List;

/**
 * Invalid formatter configuration. Holds every problem found, not just the first.
 */
public class FormatException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

    public FormatException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
