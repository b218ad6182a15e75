package com.py2smt.source;

/**
 * Malformed input: the source program (or serialized tree) could not be turned into a
 * syntax tree. Carries the 1-based position and the offending line when known.
 */
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;
    private final String text;

    public ParseException(String message) {
        super(message);
        this.line = 0;
        this.column = 0;
        this.text = null;
    }

    public ParseException(String message, int line, int column, String text) {
        super(String.format("Syntax error at line %d, column %d: %s", line, column, message));
        this.line = line;
        this.column = column;
        this.text = text;
    }

    public ParseException(Token token, String expected, String text) {
        this(String.format("Expected %s, but found '%s' (%s)", expected, token.lexeme(), token.type()),
                token.line(), token.column(), text);
    }

    /** 1-based line, or 0 when no position is known. */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** The source line the error was found on, or null. */
    public String getText() {
        return text;
    }

    public boolean hasPosition() {
        return line > 0;
    }
}
