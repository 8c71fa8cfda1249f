package com.shorthand.notation.parser.exception;

/**
 * Structural parse failure. Parsing stops at the first one; recoverable
 * problems are reported as diagnostics instead.
 */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String reason;
    private final int line;
    private final int column;

    public ParseException(String reason, int line, int column) {
        super(reason + " at line " + line + ", column " + column);
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    public ParseException(String reason, int line, int column, Throwable cause) {
        super(reason + " at line " + line + ", column " + column, cause);
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    /**
     * The failure without its position.
     */
    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
