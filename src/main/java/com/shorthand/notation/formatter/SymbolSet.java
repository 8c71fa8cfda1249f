package com.shorthand.notation.formatter;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Spellings of the reserved symbols. The tokenizer reads both sets back to
 * the same tokens, so switching sets never changes what a document means.
 */
@Getter
@RequiredArgsConstructor
public enum SymbolSet {
    UNICODE("∈", "→", "◊", "∇"),
    ASCII("in", "->", "<>", "\\/");

    private final String membership;
    private final String arrow;
    private final String dependency;
    private final String gradient;

    public static SymbolSet forPreference(boolean preferUnicode) {
        return preferUnicode ? UNICODE : ASCII;
    }

    /**
     * Rewrites canonical (Unicode) text such as a tag or type into this set.
     * Membership is left alone: its ASCII form is a word and only has meaning
     * between a state-variable name and its type.
     */
    public String render(String canonical) {
        if (this == UNICODE) {
            return canonical;
        }
        return canonical
                .replace(UNICODE.arrow, arrow)
                .replace(UNICODE.dependency, dependency)
                .replace(UNICODE.gradient, gradient);
    }
}
