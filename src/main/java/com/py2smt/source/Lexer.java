package com.py2smt.source;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Splits Python source into tokens, turning leading whitespace into
 * {@link TokenType#INDENT}/{@link TokenType#DEDENT} tokens and line ends into
 * {@link TokenType#NEWLINE}. Line ends inside brackets or after a backslash do not end the
 * logical line.
 */
public class Lexer {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    // Longest first so that "**=" wins over "**" and "*".
    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=",
            "->", "**", "//", "<<", ">>", "<=", ">=", "==", "!=", ":=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };

    private static final int TAB_SIZE = 8;

    private final String input;
    private final String[] sourceLines;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int position = 0;
    private int line = 1;
    private int column = 1;
    private int bracketDepth = 0;
    private boolean atLineStart = true;

    public Lexer(String input) {
        this.input = input;
        this.sourceLines = input.split("\n", -1);
    }

    public List<Token> tokenize() {
        indents.push(0);

        while (!isAtEnd()) {
            if (atLineStart && bracketDepth == 0) {
                readIndentation();
                continue;
            }

            char c = peek();
            if (c == ' ' || c == '\t' || c == '\f' || c == '\r') {
                advance();
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\' && peekNext() == '\n') {
                advance();
                advance();
            } else if (c == '\\' && peekNext() == '\r' && peekAt(2) == '\n') {
                advance();
                advance();
                advance();
            } else if (c == '\n') {
                if (bracketDepth == 0) {
                    add(TokenType.NEWLINE, "", line, column);
                    atLineStart = true;
                }
                advance();
            } else if (Character.isLetter(c) || c == '_') {
                readIdentifier();
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekNext()))) {
                readNumber();
            } else if (c == '\'' || c == '"') {
                readString(c);
            } else {
                readOperator();
            }
        }

        if (bracketDepth > 0) {
            throw error("unexpected EOF while looking for closing bracket", line, column);
        }
        if (!tokens.isEmpty() && !atLineStart) {
            add(TokenType.NEWLINE, "", line, column);
        }
        while (indents.peek() > 0) {
            indents.pop();
            add(TokenType.DEDENT, "", line, 1);
        }
        add(TokenType.END, "", line, column);
        return tokens;
    }

    private void readIndentation() {
        int width = 0;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\f')) {
            width = peek() == '\t' ? (width / TAB_SIZE + 1) * TAB_SIZE : width + 1;
            advance();
        }
        if (isAtEnd()) {
            return;
        }

        char c = peek();
        if (c == '#') {
            skipComment();
        }
        if (!isAtEnd() && (peek() == '\n' || peek() == '\r')) {
            // blank line, indentation is irrelevant
            advance();
            return;
        }
        if (isAtEnd()) {
            return;
        }

        atLineStart = false;
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            add(TokenType.INDENT, "", line, 1);
        } else if (width < current) {
            while (width < indents.peek()) {
                indents.pop();
                add(TokenType.DEDENT, "", line, 1);
            }
            if (width != indents.peek()) {
                throw error("unindent does not match any outer indentation level", line, column);
            }
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private void readIdentifier() {
        int startLine = line;
        int startColumn = column;
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            sb.append(advance());
        }
        String word = sb.toString();
        if (!KEYWORDS.contains(word) && !isAtEnd() && (peek() == '\'' || peek() == '"')) {
            throw error("string prefixes are not supported: " + word, startLine, startColumn);
        }
        add(KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.NAME, word, startLine, startColumn);
    }

    private void readNumber() {
        int startLine = line;
        int startColumn = column;
        StringBuilder sb = new StringBuilder();

        if (peek() == '0' && "xXoObB".indexOf(peekNext()) >= 0) {
            sb.append(advance()).append(advance());
            while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
                sb.append(advance());
            }
        } else {
            readDigits(sb);
            if (!isAtEnd() && peek() == '.') {
                sb.append(advance());
                readDigits(sb);
            }
            if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
                sb.append(advance());
                if (!isAtEnd() && (peek() == '+' || peek() == '-')) {
                    sb.append(advance());
                }
                if (isAtEnd() || !Character.isDigit(peek())) {
                    throw error("invalid decimal literal", startLine, startColumn);
                }
                readDigits(sb);
            }
            if (!isAtEnd() && (Character.isLetter(peek()) || peek() == '_')) {
                throw error("invalid decimal literal", startLine, startColumn);
            }
        }
        add(TokenType.NUMBER, sb.toString(), startLine, startColumn);
    }

    private void readDigits(StringBuilder sb) {
        while (!isAtEnd() && (Character.isDigit(peek()) || peek() == '_')) {
            sb.append(advance());
        }
    }

    private void readString(char quote) {
        int startLine = line;
        int startColumn = column;
        boolean triple = peekNext() == quote && peekAt(2) == quote;
        advance();
        if (triple) {
            advance();
            advance();
        }

        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw error("unterminated string literal", startLine, startColumn);
            }
            char c = peek();
            if (c == quote && (!triple || (peekNext() == quote && peekAt(2) == quote))) {
                advance();
                if (triple) {
                    advance();
                    advance();
                }
                break;
            }
            if (c == '\n' && !triple) {
                throw error("unterminated string literal", startLine, startColumn);
            }
            if (c == '\\') {
                advance();
                if (isAtEnd()) {
                    throw error("unterminated string literal", startLine, startColumn);
                }
                appendEscape(value, advance());
            } else {
                value.append(advance());
            }
        }
        add(TokenType.STRING, value.toString(), startLine, startColumn);
    }

    private void appendEscape(StringBuilder value, char escaped) {
        switch (escaped) {
            case 'n' -> value.append('\n');
            case 't' -> value.append('\t');
            case 'r' -> value.append('\r');
            case '0' -> value.append('\0');
            case '\\' -> value.append('\\');
            case '\'' -> value.append('\'');
            case '"' -> value.append('"');
            case '\n' -> {
                // escaped line end continues the literal
            }
            default -> value.append('\\').append(escaped);
        }
    }

    private void readOperator() {
        int startLine = line;
        int startColumn = column;
        for (String op : OPERATORS) {
            if (input.startsWith(op, position)) {
                for (int i = 0; i < op.length(); i++) {
                    advance();
                }
                trackBrackets(op, startLine, startColumn);
                add(TokenType.OPERATOR, op, startLine, startColumn);
                return;
            }
        }
        throw error("invalid character '" + peek() + "'", startLine, startColumn);
    }

    private void trackBrackets(String op, int startLine, int startColumn) {
        switch (op) {
            case "(", "[", "{" -> bracketDepth++;
            case ")", "]", "}" -> {
                if (bracketDepth == 0) {
                    throw error("unmatched '" + op + "'", startLine, startColumn);
                }
                bracketDepth--;
            }
            default -> {
            }
        }
    }

    private void add(TokenType type, String lexeme, int tokenLine, int tokenColumn) {
        tokens.add(new Token(type, lexeme, tokenLine, tokenColumn));
    }

    private ParseException error(String message, int errorLine, int errorColumn) {
        return new ParseException(message, errorLine, errorColumn, lineText(errorLine));
    }

    String lineText(int lineNumber) {
        return lineNumber >= 1 && lineNumber <= sourceLines.length ? sourceLines[lineNumber - 1] : "";
    }

    private boolean isAtEnd() {
        return position >= input.length();
    }

    private char peek() {
        return input.charAt(position);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        int index = position + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private char advance() {
        char c = input.charAt(position++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }
}
