package com.shorthand.notation.cli.output;

import java.io.PrintWriter;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shorthand.notation.cli.model.ValidatedFormatOptions;
import com.shorthand.notation.formatter.FormatConfig;

/**
 * Responsible only for printing CLI output for the "format" command.
 * Formatted text and check results go to the command's output stream;
 * progress and failures go to the log.
 */
public class FormatResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(FormatResultsPrinter.class);

    private final PrintWriter out;

    public FormatResultsPrinter(PrintWriter out) {
        this.out = out;
    }

    public void printBanner(ValidatedFormatOptions v, int fileCount) {
        FormatConfig c = v.getConfig();
        log.info("=================================================");
        log.info("Shorthand Formatter");
        log.info("=================================================");
        log.info("Input: {}", v.getInput());
        log.info("Files: {}", fileCount);
        log.info("Indent: {}", c.getIndent());
        log.info("Align Types: {}", c.isAlignTypes());
        log.info("Symbols: {}", c.isPreferUnicode() ? "unicode" : "ascii");
        log.info("Sort State: {}", c.getSortStateBy());
        log.info("Max Line Length: {}", c.getMaxLineLength());
        log.info("=================================================");
    }

    public void printFormatted(Path file, String formatted, boolean multipleFiles) {
        if (multipleFiles) {
            out.println();
            out.println("=== " + file + " ===");
        }
        out.print(formatted);
        out.flush();
    }

    public void printWritten(Path file, boolean changed) {
        if (changed) {
            log.info("Formatted: {}", file);
        } else {
            log.info("Unchanged: {}", file);
        }
    }

    public void printWouldReformat(Path file) {
        out.println("Would reformat: " + file);
        out.flush();
    }

    /**
     * Line-by-line comparison; lines present on only one side are shown
     * against an empty counterpart.
     */
    public void printDiff(Path file, String original, String formatted) {
        String[] before = original.split("\n", -1);
        String[] after = formatted.split("\n", -1);

        out.println();
        out.println("--- " + file + " (original)");
        out.println("+++ " + file + " (formatted)");
        for (int i = 0; i < Math.max(before.length, after.length); i++) {
            String b = i < before.length ? before[i] : "";
            String a = i < after.length ? after[i] : "";
            if (!b.equals(a)) {
                out.println("- " + (i + 1) + ": " + b);
                out.println("+ " + (i + 1) + ": " + a);
            }
        }
        out.flush();
    }

    public void printCheckSummary(int total, int needingFormat) {
        if (needingFormat == 0) {
            out.println("All " + total + " files are formatted correctly");
        } else {
            out.println(needingFormat + " of " + total + " files would be reformatted");
        }
        out.flush();
    }

    public void printOverlongLines(Path file, Iterable<Integer> lines, int maxLineLength) {
        for (Integer line : lines) {
            log.warn("{}:{}: line exceeds {} characters", file, line, maxLineLength);
        }
    }

    public void printFailure(Path file, Exception e, boolean verbose) {
        if (verbose) {
            log.error("Error formatting {}", file, e);
        } else {
            log.error("Error formatting {}: {}", file, e.getMessage());
        }
    }
}
