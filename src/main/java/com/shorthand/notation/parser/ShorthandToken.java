package com.shorthand.notation.parser;

import lombok.Value;

/**
 * Represents a token from the shorthand tokenizer.
 */
@Value
public class ShorthandToken {
    TokenType type;
    String value;
    int line;
    /** 1-based, counted in code points. */
    int column;
    /** Width in code points of the token in the source, which differs from the value for strings and ASCII aliases. */
    int width;

    public enum TokenType {
        IDENTIFIER,
        NUMBER,
        STRING,
        SYMBOL,
        BRACKET_OPEN,
        BRACKET_CLOSE,
        COLON,
        ARROW,
        LPAREN,
        RPAREN,
        COMMA,
        AT,
        COMMENT,
        NEWLINE,
        INDENT,
        DEDENT,
        EOF
    }

    public ShorthandToken(TokenType type, String value, int line, int column, int width) {
        this.type = type;
        this.value = value;
        this.line = line;
        this.column = column;
        this.width = width;
    }

    public ShorthandToken(TokenType type, String value, int line, int column) {
        this(type, value, line, column, value.codePointCount(0, value.length()));
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isSymbol(String symbol) {
        return type == TokenType.SYMBOL && value.equals(symbol);
    }

    public int getEndColumn() {
        return column + width;
    }
}
