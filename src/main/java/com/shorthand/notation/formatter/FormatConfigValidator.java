package com.shorthand.notation.formatter;

import java.util.ArrayList;
import java.util.List;

import com.shorthand.notation.formatter.exception.FormatException;

public class FormatConfigValidator {

	public void validate(FormatConfig config) {
		List<String> errors = new ArrayList<>();

		if (config == null) {
			errors.add("Format configuration is required.");
			throw new FormatException(errors);
		}

		if (config.getIndent() <= 0) {
			errors.add("Indent must be a positive number of spaces. Got: " + config.getIndent());
		}
		if (config.getMaxLineLength() <= 0) {
			errors.add("Maximum line length must be positive. Got: " + config.getMaxLineLength());
		}
		if (config.getSortStateBy() == null) {
			errors.add("State sort order is required (location, name or none).");
		}

		if (!errors.isEmpty()) {
			throw new FormatException(errors);
		}
	}
}
