package com.shorthand.notation.cli.model;

import java.nio.file.Path;

import com.shorthand.notation.formatter.FormatConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the format run. Keeps FormatCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedFormatOptions {
    Path input;
    FormatConfig config;
}
