package com.shorthand.notation.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "parse" command.
 */
@Getter
public class ParseOptions {

	@Parameters(index = "0", paramLabel = "<input>", description = "Input .pys file")
	private Path input;

	@Option(names = { "--output", "-o" }, description = "Output JSON file (default: stdout)")
	private Path output;

	@Option(names = { "--pretty" }, description = "Pretty-print JSON output")
	private boolean pretty;
}
