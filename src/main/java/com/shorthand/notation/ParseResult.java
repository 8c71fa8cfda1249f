package com.shorthand.notation;

import com.shorthand.notation.model.ShorthandDocument;

import lombok.Builder;
import lombok.Data;

/**
 * Result of parsing shorthand text through {@link Shorthand#parse(String)}.
 */
@Data
@Builder
public class ParseResult {
    private boolean success;
    private ShorthandDocument document;

    private String errorMessage;
    private int errorLine;
    private int errorColumn;

    public static ParseResult success(ShorthandDocument document) {
        return ParseResult.builder()
                .success(true)
                .document(document)
                .build();
    }

    public static ParseResult failure(String errorMessage, int line, int column) {
        return ParseResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorLine(line)
                .errorColumn(column)
                .build();
    }
}
