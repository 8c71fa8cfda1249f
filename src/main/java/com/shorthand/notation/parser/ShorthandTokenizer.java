package com.shorthand.notation.parser;

import com.shorthand.notation.parser.ShorthandToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tokenizer for shorthand source text.
 *
 * Never fails: anything it cannot classify becomes a single-character
 * {@link TokenType#SYMBOL} and is left for the parser to reject. Indentation
 * is turned into synthetic INDENT/DEDENT tokens so the parser never looks at
 * leading whitespace.
 */
public class ShorthandTokenizer {
    private static final Logger log = LoggerFactory.getLogger(ShorthandTokenizer.class);

    public static final String MEMBERSHIP = "∈";
    public static final String ARROW = "→";
    public static final String GRADIENT = "∇";
    public static final String DEPENDENCY = "◊";

    private static final int TAB_WIDTH = 4;

    private final String source;
    private final List<ShorthandToken> tokens = new ArrayList<>();
    private final Deque<Integer> indentStack = new ArrayDeque<>();

    private String currentLine;
    private int lineNumber;
    private int pos;

    public ShorthandTokenizer(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * Tokenize the entire source text.
     */
    public List<ShorthandToken> tokenize() {
        tokens.clear();
        indentStack.clear();
        indentStack.push(0);

        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            lineNumber = i + 1;
            currentLine = stripCarriageReturn(lines[i]);
            pos = 0;

            int width = measureIndent();
            if (pos >= currentLine.length()) {
                // Blank line, leaves indentation untouched
                continue;
            }

            if (!startsComment()) {
                adjustIndentation(width);
            }

            scanLine();
            tokens.add(new ShorthandToken(TokenType.NEWLINE, "\n", lineNumber, column(currentLine.length()), 1));
        }

        int lastLine = Math.max(1, lines.length);
        while (indentStack.size() > 1) {
            indentStack.pop();
            tokens.add(new ShorthandToken(TokenType.DEDENT, "", lastLine, 1, 0));
        }
        tokens.add(new ShorthandToken(TokenType.EOF, "", lastLine, 1, 0));

        log.debug("Tokenized {} lines into {} tokens", lines.length, tokens.size());
        return List.copyOf(tokens);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * 1-based column of a char index on the current line, counted in code points.
     */
    private int column(int index) {
        return currentLine.codePointCount(0, index) + 1;
    }

    private int measureIndent() {
        int width = 0;
        while (pos < currentLine.length()) {
            char c = currentLine.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_WIDTH + 1) * TAB_WIDTH;
            } else {
                break;
            }
            pos++;
        }
        return width;
    }

    private void adjustIndentation(int width) {
        int column = column(pos);
        if (width > indentStack.peek()) {
            indentStack.push(width);
            tokens.add(new ShorthandToken(TokenType.INDENT, "", lineNumber, column, 0));
            return;
        }

        while (width < indentStack.peek()) {
            indentStack.pop();
            if (width > indentStack.peek()) {
                // Landed between two levels: the closed level is replaced, the enclosing block stays open
                log.debug("Inconsistent dedent to width {} at line {}", width, lineNumber);
                indentStack.push(width);
                return;
            }
            tokens.add(new ShorthandToken(TokenType.DEDENT, "", lineNumber, column, 0));
        }
    }

    private boolean startsComment() {
        if (pos > 0 && !Character.isWhitespace(currentLine.charAt(pos - 1))) {
            return false;
        }
        return currentLine.charAt(pos) == '#' || currentLine.startsWith("//", pos);
    }

    private void scanLine() {
        while (pos < currentLine.length()) {
            char c = currentLine.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            if (startsComment()) {
                String text = currentLine.substring(pos).stripTrailing();
                tokens.add(new ShorthandToken(TokenType.COMMENT, text, lineNumber, column(pos)));
                pos = currentLine.length();
                return;
            }

            tokens.add(nextToken(c));
        }
    }

    private ShorthandToken nextToken(char c) {
        int startCol = column(pos);

        switch (c) {
            case '[':
                return single(TokenType.BRACKET_OPEN, startCol);
            case ']':
                return single(TokenType.BRACKET_CLOSE, startCol);
            case ':':
                return single(TokenType.COLON, startCol);
            case '(':
                return single(TokenType.LPAREN, startCol);
            case ')':
                return single(TokenType.RPAREN, startCol);
            case ',':
                return single(TokenType.COMMA, startCol);
            case '@':
                return single(TokenType.AT, startCol);
            case '→':
                return single(TokenType.ARROW, startCol);
            case '∈':
            case '∇':
            case '◊':
                return single(TokenType.SYMBOL, startCol);
            case '\'':
            case '"':
                return readString(c, startCol);
            default:
                break;
        }

        // ASCII spellings of the reserved symbols
        if (currentLine.startsWith("->", pos)) {
            pos += 2;
            return new ShorthandToken(TokenType.ARROW, ARROW, lineNumber, startCol, 2);
        }
        if (currentLine.startsWith("<>", pos)) {
            pos += 2;
            return new ShorthandToken(TokenType.SYMBOL, DEPENDENCY, lineNumber, startCol, 2);
        }
        if (currentLine.startsWith("\\/", pos)) {
            pos += 2;
            return new ShorthandToken(TokenType.SYMBOL, GRADIENT, lineNumber, startCol, 2);
        }

        if (c >= '0' && c <= '9') {
            return readNumber(startCol);
        }

        if (Character.isLetter(c) || c == '_') {
            return readIdentifier(startCol);
        }

        // Lexical anomaly: one code point, judged later by the parser
        int end = pos + Character.charCount(currentLine.codePointAt(pos));
        String text = currentLine.substring(pos, end);
        pos = end;
        return new ShorthandToken(TokenType.SYMBOL, text, lineNumber, startCol);
    }

    private ShorthandToken single(TokenType type, int startCol) {
        String text = String.valueOf(currentLine.charAt(pos));
        pos++;
        return new ShorthandToken(type, text, lineNumber, startCol);
    }

    private ShorthandToken readString(char quote, int startCol) {
        int start = pos;
        pos++; // Skip opening quote
        StringBuilder sb = new StringBuilder();

        while (pos < currentLine.length() && currentLine.charAt(pos) != quote) {
            sb.append(currentLine.charAt(pos));
            pos++;
        }
        if (pos < currentLine.length()) {
            pos++; // Closing quote
        }

        return new ShorthandToken(TokenType.STRING, sb.toString(), lineNumber, startCol,
                currentLine.codePointCount(start, pos));
    }

    private ShorthandToken readNumber(int startCol) {
        int start = pos;
        while (pos < currentLine.length() && currentLine.charAt(pos) >= '0' && currentLine.charAt(pos) <= '9') {
            pos++;
        }
        return new ShorthandToken(TokenType.NUMBER, currentLine.substring(start, pos), lineNumber, startCol);
    }

    private ShorthandToken readIdentifier(int startCol) {
        int start = pos;
        while (pos < currentLine.length()) {
            char c = currentLine.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        return new ShorthandToken(TokenType.IDENTIFIER, currentLine.substring(start, pos), lineNumber, startCol);
    }
}
