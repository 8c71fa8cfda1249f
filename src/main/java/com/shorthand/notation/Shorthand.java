package com.shorthand.notation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shorthand.notation.formatter.FormatConfig;
import com.shorthand.notation.formatter.ShorthandFormatter;
import com.shorthand.notation.formatter.exception.FormatException;
import com.shorthand.notation.model.ShorthandDocument;
import com.shorthand.notation.parser.ShorthandParser;
import com.shorthand.notation.parser.exception.ParseException;

/**
 * Entry points into the notation front end. Malformed input is reported
 * through the returned result instead of an exception.
 */
public final class Shorthand {
    private static final Logger log = LoggerFactory.getLogger(Shorthand.class);

    private static final ShorthandFormatter FORMATTER = new ShorthandFormatter();

    private Shorthand() {
    }

    public static ParseResult parse(String text) {
        try {
            return ParseResult.success(ShorthandParser.parseText(text));
        } catch (ParseException e) {
            log.debug("Parse failed: {}", e.getMessage());
            return ParseResult.failure(e.getReason(), e.getLine(), e.getColumn());
        }
    }

    public static FormatResult format(ShorthandDocument document, FormatConfig config) {
        try {
            return FormatResult.success(FORMATTER.format(document, config));
        } catch (FormatException e) {
            return FormatResult.failure(e.getMessage());
        }
    }

    public static FormatResult format(String text, FormatConfig config) {
        try {
            return FormatResult.success(FORMATTER.format(text, config));
        } catch (ParseException | FormatException e) {
            log.debug("Format failed: {}", e.getMessage());
            return FormatResult.failure(e.getMessage());
        }
    }
}
