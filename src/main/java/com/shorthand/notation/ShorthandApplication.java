package com.shorthand.notation;

import com.shorthand.notation.cli.ShorthandCommand;

import picocli.CommandLine;

/**
 * Main entry point for the shorthand toolchain CLI: parse, format and lint
 * {@code .pys} files.
 */
public class ShorthandApplication {

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new ShorthandCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
