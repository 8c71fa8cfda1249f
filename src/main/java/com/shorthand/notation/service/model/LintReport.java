package com.shorthand.notation.service.model;

import java.nio.file.Path;
import java.util.List;

import com.shorthand.notation.model.Diagnostic;
import com.shorthand.notation.model.Severity;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Findings for one linted file. A parse failure is recorded as a single
 * ERROR entry at the failure position.
 */
@Value
@Builder
public class LintReport {
    @NonNull
    Path file;

    /** Null when the file failed to parse. */
    String moduleName;

    @Singular
    List<Diagnostic> diagnostics;

    public boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }

    public boolean hasWarnings() {
        return count(Severity.WARNING) > 0;
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(d -> d.getSeverity() == severity).count();
    }

    /**
     * True when the file passes: no errors, and with {@code strict} no warnings either.
     */
    public boolean passes(boolean strict) {
        return !hasErrors() && (!strict || !hasWarnings());
    }
}
