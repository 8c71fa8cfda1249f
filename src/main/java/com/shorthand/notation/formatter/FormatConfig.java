package com.shorthand.notation.formatter;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for {@link ShorthandFormatter}. Always passed explicitly; there is
 * no shared default instance to mutate.
 */
@Value
@Builder(toBuilder = true)
public class FormatConfig {

    /**
     * Spaces per indentation level inside an entity.
     */
    @Builder.Default
    int indent = 2;

    /**
     * Pad state-variable names so the membership symbols of one block line up.
     */
    @Builder.Default
    boolean alignTypes = true;

    /**
     * Write the Unicode symbols; false writes their ASCII spellings.
     */
    @Builder.Default
    boolean preferUnicode = true;

    @Builder.Default
    StateSortOrder sortStateBy = StateSortOrder.LOCATION;

    /**
     * Lines are never wrapped; this only feeds overlong-line reporting.
     */
    @Builder.Default
    int maxLineLength = 100;

    public static FormatConfig defaults() {
        return FormatConfig.builder().build();
    }
}
