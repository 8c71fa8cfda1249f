package com.shorthand.notation.cli.model;

import java.nio.file.Path;

import com.shorthand.notation.formatter.StateSortOrder;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "format" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class FormatOptions {

	@Parameters(index = "0", paramLabel = "<input>", description = "Input .pys file or directory")
	private Path input;

	@Option(names = { "--write", "-w" }, description = "Write changes in place (default: print to stdout)")
	private boolean write;

	@Option(names = { "--check" }, description = "Report files that need formatting without changing them")
	private boolean check;

	@Option(names = { "--diff" }, description = "Show changed lines when using --check")
	private boolean diff;

	@Option(names = { "--indent" }, defaultValue = "2", description = "Indentation spaces (default: ${DEFAULT-VALUE})")
	private int indent;

	@Option(names = { "--no-align" }, description = "Don't align type annotations")
	private boolean noAlign;

	@Option(names = { "--ascii" }, description = "Use ASCII notation instead of Unicode")
	private boolean ascii;

	@Option(names = { "--sort-state" }, defaultValue = "LOCATION",
			description = "How to order state variables: ${COMPLETION-CANDIDATES} (default: location)")
	private StateSortOrder sortState;

	@Option(names = { "--line-length" }, defaultValue = "100",
			description = "Maximum line length (default: ${DEFAULT-VALUE})")
	private int lineLength;

	@Option(names = { "--verbose", "-v" }, description = "Verbose output")
	private boolean verbose;
}
