package com.py2smt.source;

import com.py2smt.tree.BinaryOperator;
import com.py2smt.tree.BooleanOperator;
import com.py2smt.tree.CompareOperator;
import com.py2smt.tree.SyntaxNode;
import com.py2smt.tree.UnaryOperator;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the Python subset, producing a {@link SyntaxNode.Module}.
 * <p>
 * Constructs outside the subset that Python itself accepts (loops, calls, augmented
 * assignment, containers, ...) are parsed completely and returned as
 * {@link SyntaxNode.Unsupported} nodes named after their Python ast kind. Anything else
 * raises a {@link ParseException} pointing at the offending token.
 */
public class PythonParser {

    private static final Set<String> AUGMENTED_ASSIGNMENTS = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", "@=", "&=", "|=", "^=", "<<=", ">>=");

    private static final Set<String> COMPARISON_TOKENS = Set.of("==", "!=", "<", "<=", ">", ">=");

    private Lexer lexer;
    private List<Token> tokens;
    private int current;

    public SyntaxNode.Module parse(String source) {
        lexer = new Lexer(source);
        tokens = lexer.tokenize();
        current = 0;

        MutableList<SyntaxNode> statements = Lists.mutable.empty();
        while (!check(TokenType.END)) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            if (check(TokenType.INDENT)) {
                throw error(peek(), "unexpected indent");
            }
            statements.addAll(statement());
        }
        return new SyntaxNode.Module(statements.toImmutable());
    }

    // ---------------------------------------------------------------- statements

    private List<SyntaxNode> statement() {
        Token token = peek();
        if (token.isKeyword("def")) {
            return List.of(functionDef());
        }
        if (token.isKeyword("if")) {
            advance();
            return List.of(ifStatement());
        }
        if (token.isKeyword("while")) {
            return List.of(whileStatement());
        }
        if (token.isKeyword("for")) {
            return List.of(forStatement());
        }
        return simpleStatements();
    }

    private SyntaxNode functionDef() {
        consumeKeyword("def");
        String name = consume(TokenType.NAME, "function name").lexeme();
        consumeOperator("(");

        MutableList<String> params = Lists.mutable.empty();
        while (!check(TokenType.OPERATOR, ")")) {
            params.add(consume(TokenType.NAME, "parameter name").lexeme());
            if (matchOperator(":")) {
                expression();
            }
            if (matchOperator("=")) {
                expression();
            }
            if (!matchOperator(",")) {
                break;
            }
        }
        consumeOperator(")");
        if (matchOperator("->")) {
            expression();
        }
        consumeOperator(":");
        return new SyntaxNode.FunctionDef(name, params.toImmutable(), suite().toImmutable());
    }

    // The "if" or "elif" keyword has already been consumed.
    private SyntaxNode ifStatement() {
        SyntaxNode test = expression();
        consumeOperator(":");
        MutableList<SyntaxNode> body = suite();

        MutableList<SyntaxNode> orelse = Lists.mutable.empty();
        if (check(TokenType.KEYWORD, "elif")) {
            advance();
            orelse.add(ifStatement());
        } else if (check(TokenType.KEYWORD, "else")) {
            advance();
            consumeOperator(":");
            orelse = suite();
        }
        return new SyntaxNode.If(test, body.toImmutable(), orelse.toImmutable());
    }

    private SyntaxNode whileStatement() {
        consumeKeyword("while");
        expression();
        consumeOperator(":");
        suite();
        optionalElseSuite();
        return new SyntaxNode.Unsupported("While");
    }

    private SyntaxNode forStatement() {
        consumeKeyword("for");
        targetList();
        consumeKeyword("in");
        expressionList();
        consumeOperator(":");
        suite();
        optionalElseSuite();
        return new SyntaxNode.Unsupported("For");
    }

    private void optionalElseSuite() {
        if (check(TokenType.KEYWORD, "else")) {
            advance();
            consumeOperator(":");
            suite();
        }
    }

    private void targetList() {
        do {
            primary();
        } while (matchOperator(","));
    }

    private MutableList<SyntaxNode> suite() {
        if (!match(TokenType.NEWLINE)) {
            return Lists.mutable.ofAll(simpleStatements());
        }
        consume(TokenType.INDENT, "an indented block");
        MutableList<SyntaxNode> body = Lists.mutable.empty();
        while (!check(TokenType.DEDENT) && !check(TokenType.END)) {
            body.addAll(statement());
        }
        match(TokenType.DEDENT);
        return body;
    }

    private List<SyntaxNode> simpleStatements() {
        MutableList<SyntaxNode> statements = Lists.mutable.empty();
        statements.add(simpleStatement());
        while (matchOperator(";")) {
            if (check(TokenType.NEWLINE)) {
                break;
            }
            statements.add(simpleStatement());
        }
        consume(TokenType.NEWLINE, "end of line");
        return statements;
    }

    private SyntaxNode simpleStatement() {
        Token token = peek();
        if (token.type() != TokenType.KEYWORD) {
            return expressionStatement();
        }
        return switch (token.lexeme()) {
            case "return" -> {
                advance();
                if (check(TokenType.NEWLINE) || check(TokenType.OPERATOR, ";")) {
                    yield new SyntaxNode.Return(null);
                }
                yield new SyntaxNode.Return(expressionList());
            }
            case "pass" -> {
                advance();
                yield new SyntaxNode.Unsupported("Pass");
            }
            case "break" -> {
                advance();
                yield new SyntaxNode.Unsupported("Break");
            }
            case "continue" -> {
                advance();
                yield new SyntaxNode.Unsupported("Continue");
            }
            case "True", "False", "None", "not" -> expressionStatement();
            default -> throw error(token, "unsupported statement '" + token.lexeme() + "'");
        };
    }

    private SyntaxNode expressionStatement() {
        SyntaxNode first = expressionList();

        if (peek().type() == TokenType.OPERATOR && AUGMENTED_ASSIGNMENTS.contains(peek().lexeme())) {
            Token op = advance();
            requireAssignable(first, op);
            expressionList();
            return new SyntaxNode.Unsupported("AugAssign");
        }

        if (!check(TokenType.OPERATOR, "=")) {
            return new SyntaxNode.Expr(first);
        }

        MutableList<SyntaxNode> chain = Lists.mutable.with(first);
        while (check(TokenType.OPERATOR, "=")) {
            Token assignToken = advance();
            requireAssignable(chain.getLast(), assignToken);
            chain.add(expressionList());
        }
        SyntaxNode value = chain.getLast();
        return new SyntaxNode.Assign(chain.take(chain.size() - 1).toImmutable(), value);
    }

    private void requireAssignable(SyntaxNode target, Token at) {
        if (!(target instanceof SyntaxNode.Name name)) {
            throw error(at, "cannot assign to expression here, only plain names are supported");
        }
        if (name.identifier().equals("True") || name.identifier().equals("False") || name.identifier().equals("None")) {
            throw error(at, "cannot assign to " + name.identifier());
        }
    }

    // ---------------------------------------------------------------- expressions

    // expression (',' expression)* : a bare tuple is not part of the subset.
    private SyntaxNode expressionList() {
        SyntaxNode first = expression();
        if (!check(TokenType.OPERATOR, ",")) {
            return first;
        }
        while (matchOperator(",")) {
            if (endsExpressionList()) {
                break;
            }
            expression();
        }
        return new SyntaxNode.Unsupported("Tuple");
    }

    private boolean endsExpressionList() {
        Token token = peek();
        return token.type() == TokenType.NEWLINE
                || token.isOperator("=") || token.isOperator(";") || token.isOperator(":")
                || token.isOperator(")") || token.isOperator("]") || token.isOperator("}")
                || (token.type() == TokenType.OPERATOR && AUGMENTED_ASSIGNMENTS.contains(token.lexeme()));
    }

    private SyntaxNode expression() {
        SyntaxNode result = orTest();
        if (check(TokenType.KEYWORD, "if")) {
            advance();
            orTest();
            consumeKeyword("else");
            expression();
            return new SyntaxNode.Unsupported("IfExp");
        }
        return result;
    }

    private SyntaxNode orTest() {
        SyntaxNode first = andTest();
        if (!check(TokenType.KEYWORD, "or")) {
            return first;
        }
        MutableList<SyntaxNode> values = Lists.mutable.with(first);
        while (matchKeyword("or")) {
            values.add(andTest());
        }
        return new SyntaxNode.BoolOp(BooleanOperator.OR, values.toImmutable());
    }

    private SyntaxNode andTest() {
        SyntaxNode first = notTest();
        if (!check(TokenType.KEYWORD, "and")) {
            return first;
        }
        MutableList<SyntaxNode> values = Lists.mutable.with(first);
        while (matchKeyword("and")) {
            values.add(notTest());
        }
        return new SyntaxNode.BoolOp(BooleanOperator.AND, values.toImmutable());
    }

    private SyntaxNode notTest() {
        if (matchKeyword("not")) {
            return new SyntaxNode.UnaryOp(UnaryOperator.NOT, notTest());
        }
        return comparison();
    }

    private SyntaxNode comparison() {
        SyntaxNode left = arithmetic();
        MutableList<CompareOperator> ops = Lists.mutable.empty();
        MutableList<SyntaxNode> comparators = Lists.mutable.empty();

        CompareOperator op;
        while ((op = comparisonOperator()) != null) {
            ops.add(op);
            comparators.add(arithmetic());
        }
        if (ops.isEmpty()) {
            return left;
        }
        return new SyntaxNode.Compare(left, ops.toImmutable(), comparators.toImmutable());
    }

    private CompareOperator comparisonOperator() {
        Token token = peek();
        if (token.type() == TokenType.OPERATOR && COMPARISON_TOKENS.contains(token.lexeme())) {
            advance();
            return switch (token.lexeme()) {
                case "==" -> CompareOperator.EQ;
                case "!=" -> CompareOperator.NOT_EQ;
                case "<" -> CompareOperator.LT;
                case "<=" -> CompareOperator.LT_E;
                case ">" -> CompareOperator.GT;
                default -> CompareOperator.GT_E;
            };
        }
        if (token.isKeyword("in")) {
            advance();
            return CompareOperator.IN;
        }
        if (token.isKeyword("not") && peekAhead(1).isKeyword("in")) {
            advance();
            advance();
            return CompareOperator.NOT_IN;
        }
        if (token.isKeyword("is")) {
            advance();
            return matchKeyword("not") ? CompareOperator.IS_NOT : CompareOperator.IS;
        }
        return null;
    }

    // Bitwise operators bind looser than shifts: | loosest, then ^, then &.
    private SyntaxNode arithmetic() {
        SyntaxNode left = bitwiseXor();
        while (check(TokenType.OPERATOR, "|")) {
            BinaryOperator op = binaryOperator(advance());
            left = new SyntaxNode.BinOp(left, op, bitwiseXor());
        }
        return left;
    }

    private SyntaxNode bitwiseXor() {
        SyntaxNode left = bitwiseAnd();
        while (check(TokenType.OPERATOR, "^")) {
            BinaryOperator op = binaryOperator(advance());
            left = new SyntaxNode.BinOp(left, op, bitwiseAnd());
        }
        return left;
    }

    private SyntaxNode bitwiseAnd() {
        SyntaxNode left = shift();
        while (check(TokenType.OPERATOR, "&")) {
            BinaryOperator op = binaryOperator(advance());
            left = new SyntaxNode.BinOp(left, op, shift());
        }
        return left;
    }

    private SyntaxNode shift() {
        SyntaxNode left = sum();
        while (checkAnyOperator("<<", ">>")) {
            BinaryOperator op = binaryOperator(advance());
            left = new SyntaxNode.BinOp(left, op, sum());
        }
        return left;
    }

    private SyntaxNode sum() {
        SyntaxNode left = term();
        while (checkAnyOperator("+", "-")) {
            BinaryOperator op = binaryOperator(advance());
            left = new SyntaxNode.BinOp(left, op, term());
        }
        return left;
    }

    private SyntaxNode term() {
        SyntaxNode left = factor();
        while (checkAnyOperator("*", "/", "//", "%", "@")) {
            BinaryOperator op = binaryOperator(advance());
            left = new SyntaxNode.BinOp(left, op, factor());
        }
        return left;
    }

    private SyntaxNode factor() {
        if (matchOperator("-")) {
            return new SyntaxNode.UnaryOp(UnaryOperator.U_SUB, factor());
        }
        if (matchOperator("+")) {
            return new SyntaxNode.UnaryOp(UnaryOperator.U_ADD, factor());
        }
        if (matchOperator("~")) {
            return new SyntaxNode.UnaryOp(UnaryOperator.INVERT, factor());
        }
        return power();
    }

    private SyntaxNode power() {
        SyntaxNode base = primary();
        if (check(TokenType.OPERATOR, "**")) {
            BinaryOperator op = binaryOperator(advance());
            return new SyntaxNode.BinOp(base, op, factor());
        }
        return base;
    }

    private BinaryOperator binaryOperator(Token token) {
        return BinaryOperator.fromToken(token.lexeme())
                .orElseThrow(() -> error(token, "unknown operator '" + token.lexeme() + "'"));
    }

    private SyntaxNode primary() {
        SyntaxNode node = atom();
        while (true) {
            if (matchOperator("(")) {
                skipUntilClosing(")", false);
                node = new SyntaxNode.Unsupported("Call");
            } else if (matchOperator("[")) {
                skipUntilClosing("]", true);
                node = new SyntaxNode.Unsupported("Subscript");
            } else if (matchOperator(".")) {
                consume(TokenType.NAME, "attribute name");
                node = new SyntaxNode.Unsupported("Attribute");
            } else {
                return node;
            }
        }
    }

    private SyntaxNode atom() {
        Token token = peek();
        switch (token.type()) {
            case NAME -> {
                advance();
                return new SyntaxNode.Name(token.lexeme());
            }
            case NUMBER -> {
                advance();
                return number(token);
            }
            case STRING -> {
                StringBuilder value = new StringBuilder();
                while (check(TokenType.STRING)) {
                    value.append(advance().lexeme());
                }
                return SyntaxNode.Constant.of(value.toString());
            }
            case KEYWORD -> {
                if (token.isKeyword("True") || token.isKeyword("False") || token.isKeyword("None")) {
                    advance();
                    return new SyntaxNode.Name(token.lexeme());
                }
                throw error(token, "unexpected keyword '" + token.lexeme() + "'");
            }
            case OPERATOR -> {
                if (matchOperator("(")) {
                    return parenthesized();
                }
                if (matchOperator("[")) {
                    skipUntilClosing("]", false);
                    return new SyntaxNode.Unsupported("List");
                }
                if (matchOperator("{")) {
                    boolean empty = check(TokenType.OPERATOR, "}");
                    boolean dict = skipUntilClosing("}", false);
                    return new SyntaxNode.Unsupported(empty || dict ? "Dict" : "Set");
                }
                throw error(token, "invalid syntax");
            }
            default -> throw error(token, "invalid syntax");
        }
    }

    private SyntaxNode parenthesized() {
        if (matchOperator(")")) {
            return new SyntaxNode.Unsupported("Tuple");
        }
        SyntaxNode inner = expression();
        if (matchOperator(")")) {
            return inner;
        }
        if (check(TokenType.OPERATOR, ",")) {
            while (matchOperator(",")) {
                if (check(TokenType.OPERATOR, ")")) {
                    break;
                }
                expression();
            }
            consumeOperator(")");
            return new SyntaxNode.Unsupported("Tuple");
        }
        throw new ParseException(peek(), "')' or ','", lexer.lineText(peek().line()));
    }

    /**
     * Parses a comma-separated element list up to the closing bracket, which is consumed.
     * Elements may be keyword arguments, {@code *} or {@code **} unpackings, {@code key: value}
     * pairs, or, in a subscript, slices with any bound left out.
     *
     * @return whether any element was a {@code key: value} pair or a {@code **} unpacking
     */
    private boolean skipUntilClosing(String closing, boolean slices) {
        boolean mapping = false;
        while (!check(TokenType.OPERATOR, closing)) {
            if (peek().type() == TokenType.NAME && peekAhead(1).isOperator("=")) {
                advance();
                advance();
                expression();
            } else if (matchOperator("**")) {
                mapping = true;
                expression();
            } else if (matchOperator("*")) {
                expression();
            } else if (slices) {
                slice(closing);
            } else {
                expression();
                if (matchOperator(":")) {
                    mapping = true;
                    expression();
                }
            }
            if (!matchOperator(",")) {
                break;
            }
        }
        consumeOperator(closing);
        return mapping;
    }

    // lower:upper:step, every part optional
    private void slice(String closing) {
        if (!check(TokenType.OPERATOR, ":")) {
            expression();
        }
        for (int part = 0; part < 2 && matchOperator(":"); part++) {
            if (!checkAnyOperator(":", ",", closing)) {
                expression();
            }
        }
    }

    private SyntaxNode number(Token token) {
        String text = token.lexeme().replace("_", "");
        try {
            if (text.length() > 2 && text.charAt(0) == '0' && "xXoObB".indexOf(text.charAt(1)) >= 0) {
                int radix = switch (Character.toLowerCase(text.charAt(1))) {
                    case 'x' -> 16;
                    case 'o' -> 8;
                    default -> 2;
                };
                return SyntaxNode.Constant.of(new BigInteger(text.substring(2), radix));
            }
            if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
                return SyntaxNode.Constant.of(Double.parseDouble(text));
            }
            if (text.length() > 1 && text.charAt(0) == '0' && !text.chars().allMatch(c -> c == '0')) {
                throw error(token, "leading zeros in decimal integer literals are not permitted");
            }
            return SyntaxNode.Constant.of(new BigInteger(text));
        } catch (NumberFormatException e) {
            throw error(token, "invalid number literal '" + token.lexeme() + "'");
        }
    }

    // ---------------------------------------------------------------- token helpers

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAhead(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.END) {
            current++;
        }
        return token;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean check(TokenType type, String lexeme) {
        return peek().is(type, lexeme);
    }

    private boolean checkAnyOperator(String... ops) {
        for (String op : ops) {
            if (peek().isOperator(op)) {
                return true;
            }
        }
        return false;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchOperator(String op) {
        if (peek().isOperator(op)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(peek(), expected, lexer.lineText(peek().line()));
    }

    private void consumeOperator(String op) {
        if (!matchOperator(op)) {
            throw new ParseException(peek(), "'" + op + "'", lexer.lineText(peek().line()));
        }
    }

    private void consumeKeyword(String keyword) {
        if (!matchKeyword(keyword)) {
            throw new ParseException(peek(), "'" + keyword + "'", lexer.lineText(peek().line()));
        }
    }

    private ParseException error(Token token, String message) {
        return new ParseException(message, token.line(), token.column(), lexer.lineText(token.line()));
    }
}
