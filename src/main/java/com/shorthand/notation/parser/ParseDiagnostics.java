package com.shorthand.notation.parser;

import java.util.ArrayList;
import java.util.List;

import com.shorthand.notation.model.Diagnostic;
import com.shorthand.notation.model.Severity;

import lombok.Getter;

/**
 * Diagnostics accumulated during a single parse.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ParseDiagnostics {
  private final List<Diagnostic> entries = new ArrayList<>();

  public void warn(int line, int column, String message) {
    entries.add(new Diagnostic(Severity.WARNING, line, column, message));
  }

  public void error(int line, int column, String message) {
    entries.add(new Diagnostic(Severity.ERROR, line, column, message));
  }

  public boolean hasErrors() {
    return entries.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR);
  }

}
