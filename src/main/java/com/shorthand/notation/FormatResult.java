package com.shorthand.notation;

import lombok.Builder;
import lombok.Data;

/**
 * Result of {@link Shorthand#format}.
 */
@Data
@Builder
public class FormatResult {
    private boolean success;
    private String text;
    private String errorMessage;

    public static FormatResult success(String text) {
        return FormatResult.builder()
                .success(true)
                .text(text)
                .build();
    }

    public static FormatResult failure(String errorMessage) {
        return FormatResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
