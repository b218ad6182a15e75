package com.py2smt.source;

/**
 * A lexical token. For {@link TokenType#STRING} the lexeme is the decoded string value;
 * for the layout tokens it is empty.
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    public boolean is(TokenType expectedType, String expectedLexeme) {
        return type == expectedType && lexeme.equals(expectedLexeme);
    }

    public boolean isOperator(String op) {
        return is(TokenType.OPERATOR, op);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenType.KEYWORD, keyword);
    }
}
