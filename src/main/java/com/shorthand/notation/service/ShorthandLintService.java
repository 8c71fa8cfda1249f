package com.shorthand.notation.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shorthand.notation.formatter.FormatConfig;
import com.shorthand.notation.formatter.ShorthandFormatter;
import com.shorthand.notation.model.Diagnostic;
import com.shorthand.notation.model.Severity;
import com.shorthand.notation.model.ShorthandDocument;
import com.shorthand.notation.parser.ShorthandParser;
import com.shorthand.notation.parser.exception.ParseException;
import com.shorthand.notation.service.model.LintReport;

import lombok.RequiredArgsConstructor;

/**
 * Collects parse failures, parser diagnostics and overlong source lines for a file.
 */
@RequiredArgsConstructor
public class ShorthandLintService {
    private static final Logger log = LoggerFactory.getLogger(ShorthandLintService.class);

    private final ShorthandFileService fileService;
    private final ShorthandFormatter formatter = new ShorthandFormatter();

    public ShorthandLintService() {
        this(new ShorthandFileService());
    }

    public LintReport lint(Path path, int maxLineLength) throws IOException {
        String source = fileService.read(path);
        return lint(path, source, maxLineLength);
    }

    public LintReport lint(Path path, String source, int maxLineLength) {
        LintReport.LintReportBuilder report = LintReport.builder().file(path);

        try {
            ShorthandDocument document = ShorthandParser.parseText(source);
            report.moduleName(document.getMetadata().getModuleName());
            document.getDiagnostics().stream()
                    .sorted(Comparator.comparingInt(Diagnostic::getLine).thenComparingInt(Diagnostic::getColumn))
                    .forEach(report::diagnostic);
        } catch (ParseException e) {
            log.debug("Lint: {} failed to parse: {}", path, e.getMessage());
            report.diagnostic(new Diagnostic(Severity.ERROR, e.getLine(), e.getColumn(), e.getReason()));
        }

        FormatConfig lengthOnly = FormatConfig.builder().maxLineLength(maxLineLength).build();
        for (Integer line : formatter.findOverlongLines(source, lengthOnly)) {
            report.diagnostic(new Diagnostic(Severity.WARNING, line, maxLineLength + 1,
                    "Line exceeds " + maxLineLength + " characters"));
        }
        return report.build();
    }
}
