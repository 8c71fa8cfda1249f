package com.shorthand.notation.cli.output;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shorthand.notation.model.Diagnostic;
import com.shorthand.notation.model.Severity;
import com.shorthand.notation.service.model.LintReport;

/**
 * Responsible only for printing CLI output for the "lint" command.
 */
public class LintResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(LintResultsPrinter.class);

    private final PrintWriter out;

    public LintResultsPrinter(PrintWriter out) {
        this.out = out;
    }

    public void printReport(LintReport report) {
        for (Diagnostic d : report.getDiagnostics()) {
            out.println(report.getFile() + ":" + d.getLine() + ":" + d.getColumn() + ": "
                    + d.getSeverity().name().toLowerCase(Locale.ROOT) + ": " + d.getMessage());
        }
        out.flush();
    }

    public void printSummary(List<LintReport> reports, boolean strict) {
        long errors = reports.stream().mapToLong(r -> r.count(Severity.ERROR)).sum();
        long warnings = reports.stream().mapToLong(r -> r.count(Severity.WARNING)).sum();
        long failing = reports.stream().filter(r -> !r.passes(strict)).count();

        out.println(reports.size() + " files checked: " + errors + " errors, " + warnings + " warnings");
        out.flush();

        if (failing > 0) {
            log.error("{} of {} files failed lint{}", failing, reports.size(), strict ? " (strict)" : "");
        } else {
            log.info("All {} files passed lint", reports.size());
        }
    }

    public void printJson(String json) {
        out.println(json);
        out.flush();
    }
}
