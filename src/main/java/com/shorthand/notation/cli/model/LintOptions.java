package com.shorthand.notation.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "lint" command.
 */
@Getter
public class LintOptions {

	@Parameters(index = "0", paramLabel = "<input>", description = "Input .pys file or directory")
	private Path input;

	@Option(names = { "--strict" }, description = "Treat warnings as errors")
	private boolean strict;

	@Option(names = { "--json" }, description = "Output diagnostics as JSON")
	private boolean json;

	@Option(names = { "--line-length" }, defaultValue = "100",
			description = "Maximum line length (default: ${DEFAULT-VALUE})")
	private int lineLength;
}
