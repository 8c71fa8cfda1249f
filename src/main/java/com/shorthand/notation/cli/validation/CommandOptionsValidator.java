package com.shorthand.notation.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.shorthand.notation.cli.exception.OptionsValidationException;
import com.shorthand.notation.cli.model.FormatOptions;
import com.shorthand.notation.cli.model.LintOptions;
import com.shorthand.notation.cli.model.ParseOptions;
import com.shorthand.notation.cli.model.ValidatedFormatOptions;
import com.shorthand.notation.formatter.FormatConfig;

public class CommandOptionsValidator {

	public ValidatedFormatOptions validate(FormatOptions o) {
		List<String> errors = new ArrayList<>();

		checkInput(o.getInput(), errors);

		if (o.isWrite() && o.isCheck()) {
			errors.add("--write and --check cannot be used together.");
		}
		if (o.isDiff() && !o.isCheck()) {
			errors.add("--diff is only valid together with --check.");
		}
		if (o.getIndent() <= 0) {
			errors.add("Indent must be a positive number of spaces. Got: " + o.getIndent());
		}
		checkLineLength(o.getLineLength(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		FormatConfig config = FormatConfig.builder()
				.indent(o.getIndent())
				.alignTypes(!o.isNoAlign())
				.preferUnicode(!o.isAscii())
				.sortStateBy(o.getSortState())
				.maxLineLength(o.getLineLength())
				.build();

		return new ValidatedFormatOptions(o.getInput().toAbsolutePath().normalize(), config);
	}

	public void validate(LintOptions o) {
		List<String> errors = new ArrayList<>();

		checkInput(o.getInput(), errors);
		checkLineLength(o.getLineLength(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
	}

	public void validate(ParseOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getInput() == null) {
			errors.add("An input file is required.");
		} else if (!Files.isRegularFile(o.getInput())) {
			errors.add("Input file does not exist or is not a regular file: " + o.getInput());
		}
		if (o.getOutput() != null && Files.isDirectory(o.getOutput())) {
			errors.add("Output must be a file, not a directory: " + o.getOutput());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
	}

	private static void checkInput(Path input, List<String> errors) {
		if (input == null) {
			errors.add("An input file or directory is required.");
		} else if (!Files.exists(input)) {
			errors.add("Input does not exist: " + input);
		}
	}

	private static void checkLineLength(int lineLength, List<String> errors) {
		if (lineLength <= 0) {
			errors.add("Line length must be positive. Got: " + lineLength);
		}
	}
}
