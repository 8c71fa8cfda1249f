package com.shorthand.notation.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level {@code shorthand} command. Does nothing by itself except print usage.
 */
@Command(
        name = "shorthand",
        mixinStandardHelpOptions = true,
        version = "shorthand 1.0.0",
        description = "Toolchain for the shorthand code-structure notation.",
        subcommands = { ParseCommand.class, FormatCommand.class, LintCommand.class }
)
public class ShorthandCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
