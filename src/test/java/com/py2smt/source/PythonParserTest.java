package com.py2smt.source;

import com.py2smt.tree.BinaryOperator;
import com.py2smt.tree.BooleanOperator;
import com.py2smt.tree.CompareOperator;
import com.py2smt.tree.SyntaxNode;
import com.py2smt.tree.UnaryOperator;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class PythonParserTest {

    private final PythonParser parser = new PythonParser();

    private SyntaxNode single(String source) {
        SyntaxNode.Module module = parser.parse(source);
        assertEquals(1, module.statements().size(), "expected a single statement in " + module);
        return module.statements().getFirst();
    }

    private SyntaxNode expression(String source) {
        SyntaxNode statement = single(source);
        assertTrue(statement instanceof SyntaxNode.Expr, "Expected Expr but got " + statement.getClass().getSimpleName());
        return ((SyntaxNode.Expr) statement).value();
    }

    private static SyntaxNode name(String identifier) {
        return new SyntaxNode.Name(identifier);
    }

    private static SyntaxNode num(long value) {
        return SyntaxNode.Constant.of(value);
    }

    // ============================================================
    // Statements
    // ============================================================

    @Test
    public void testFunctionDefinition() {
        SyntaxNode expected = new SyntaxNode.FunctionDef("f", Lists.immutable.of("x", "y"), Lists.immutable.of(
                new SyntaxNode.Assign(Lists.immutable.of(name("r")), new SyntaxNode.BinOp(name("x"), BinaryOperator.ADD, name("y"))),
                new SyntaxNode.Return(name("r"))));

        assertEquals(expected, single("def f(x, y):\n    r = x + y\n    return r\n"));
    }

    @Test
    public void testParameterAnnotationsAndDefaultsAreIgnored() {
        SyntaxNode.FunctionDef def = (SyntaxNode.FunctionDef) single("def f(x: int, y=2, z: int = 3) -> int:\n    return x\n");

        assertEquals(Lists.immutable.of("x", "y", "z"), def.params());
    }

    @Test
    public void testInlineSuite() {
        SyntaxNode.FunctionDef def = (SyntaxNode.FunctionDef) single("def f(x): return x; y = 1\n");

        assertEquals(2, def.body().size());
        assertEquals(new SyntaxNode.Return(name("x")), def.body().get(0));
    }

    @Test
    public void testIfElifElse() {
        SyntaxNode parsed = single("if a:\n    return 1\nelif b:\n    return 2\nelse:\n    return 3\n");

        SyntaxNode expected = new SyntaxNode.If(name("a"),
                Lists.immutable.of(new SyntaxNode.Return(num(1))),
                Lists.immutable.of(new SyntaxNode.If(name("b"),
                        Lists.immutable.of(new SyntaxNode.Return(num(2))),
                        Lists.immutable.of(new SyntaxNode.Return(num(3))))));
        assertEquals(expected, parsed);
    }

    @Test
    public void testIfWithoutElse() {
        SyntaxNode.If parsed = (SyntaxNode.If) single("if a: return 1\n");

        assertTrue(parsed.orelse().isEmpty());
    }

    @Test
    public void testBareReturn() {
        assertEquals(new SyntaxNode.Return(null), single("return\n"));
    }

    @Test
    public void testChainedAssignment() {
        SyntaxNode expected = new SyntaxNode.Assign(Lists.immutable.of(name("a"), name("b")), num(5));

        assertEquals(expected, single("a = b = 5\n"));
    }

    @Test
    public void testTopLevelStatementsInOrder() {
        SyntaxNode.Module module = parser.parse("a = 1\n\n\nb = 2\nc = 3");

        assertEquals(3, module.statements().size());
        assertEquals(name("c"), ((SyntaxNode.Assign) module.statements().get(2)).targets().getFirst());
    }

    // ============================================================
    // Expressions
    // ============================================================

    @Test
    public void testMultiplicationBindsTighterThanAddition() {
        SyntaxNode expected = new SyntaxNode.BinOp(num(1), BinaryOperator.ADD,
                new SyntaxNode.BinOp(num(2), BinaryOperator.MULT, num(3)));

        assertEquals(expected, expression("1 + 2 * 3\n"));
    }

    @Test
    public void testArithmeticIsLeftAssociative() {
        SyntaxNode expected = new SyntaxNode.BinOp(
                new SyntaxNode.BinOp(name("a"), BinaryOperator.SUB, name("b")), BinaryOperator.SUB, name("c"));

        assertEquals(expected, expression("a - b - c\n"));
    }

    @Test
    public void testParenthesesOverridePrecedence() {
        SyntaxNode expected = new SyntaxNode.BinOp(
                new SyntaxNode.BinOp(num(1), BinaryOperator.ADD, num(2)), BinaryOperator.MULT, num(3));

        assertEquals(expected, expression("(1 + 2) * 3\n"));
    }

    @ParameterizedTest
    @CsvSource({
            "a / b, DIV",
            "a % b, MOD",
            "a // b, FLOOR_DIV",
            "a ** b, POW"
    })
    public void testBinaryOperators(String source, BinaryOperator op) {
        assertEquals(new SyntaxNode.BinOp(name("a"), op, name("b")), expression(source + "\n"));
    }

    @Test
    public void testUnaryMinusOnLiteral() {
        assertEquals(new SyntaxNode.UnaryOp(UnaryOperator.U_SUB, num(10)), expression("-10\n"));
    }

    @Test
    public void testBooleanPrecedence() {
        SyntaxNode expected = new SyntaxNode.BoolOp(BooleanOperator.OR, Lists.immutable.of(
                name("a"),
                new SyntaxNode.BoolOp(BooleanOperator.AND, Lists.immutable.of(
                        name("b"),
                        new SyntaxNode.UnaryOp(UnaryOperator.NOT, name("c"))))));

        assertEquals(expected, expression("a or b and not c\n"));
    }

    @Test
    public void testNotAppliesToWholeComparison() {
        SyntaxNode expected = new SyntaxNode.UnaryOp(UnaryOperator.NOT, new SyntaxNode.Compare(
                name("a"), Lists.immutable.of(CompareOperator.EQ), Lists.immutable.of(name("b"))));

        assertEquals(expected, expression("not a == b\n"));
    }

    @Test
    public void testComparisonChain() {
        SyntaxNode expected = new SyntaxNode.Compare(name("a"),
                Lists.immutable.of(CompareOperator.LT, CompareOperator.LT_E),
                Lists.immutable.of(name("b"), name("c")));

        assertEquals(expected, expression("a < b <= c\n"));
    }

    @ParameterizedTest
    @CsvSource({
            "a in b, IN",
            "a not in b, NOT_IN",
            "a is b, IS",
            "a is not b, IS_NOT",
            "a != b, NOT_EQ",
            "a >= b, GT_E"
    })
    public void testComparisonOperators(String source, CompareOperator op) {
        SyntaxNode expected = new SyntaxNode.Compare(name("a"), Lists.immutable.of(op), Lists.immutable.of(name("b")));

        assertEquals(expected, expression(source + "\n"));
    }

    @Test
    public void testLiterals() {
        assertEquals(name("True"), expression("True\n"));
        assertEquals(name("None"), expression("None\n"));
        assertEquals(SyntaxNode.Constant.of(31L), expression("0x1F\n"));
        assertEquals(SyntaxNode.Constant.of(1000L), expression("1_000\n"));
        assertEquals(SyntaxNode.Constant.of(3.14), expression("3.14\n"));
        assertEquals(SyntaxNode.Constant.of(new BigInteger("99999999999999999999")), expression("99999999999999999999\n"));
        assertEquals(SyntaxNode.Constant.of("ab"), expression("'a' \"b\"\n"));
    }

    // ============================================================
    // Recognised but unsupported constructs
    // ============================================================

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "x += 1                            | AugAssign",
            "pass                              | Pass",
            "while x > 0:\\n    x = x - 1     | While",
            "for i in range(10):\\n    pass   | For",
    })
    public void testUnsupportedStatements(String source, String kind) {
        assertEquals(new SyntaxNode.Unsupported(kind), single(source.replace("\\n", "\n") + "\n"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "print(x, end=1) | Call",
            "a.b             | Attribute",
            "a[0]            | Subscript",
            "[1, 2]          | List",
            "(1, 2)          | Tuple",
            "{1: 2}          | Dict",
            "{1, 2}          | Set",
            "{}              | Dict",
            "{**d}           | Dict",
            "{**d, 1: 2}     | Dict",
            "{*a, 1}         | Set",
            "[*a, 1]         | List",
            "a[:2]           | Subscript",
            "a[1:]           | Subscript",
            "a[::2]          | Subscript",
            "a[:, 1:2:3]     | Subscript",
            "f(*a)           | Call",
            "f(**kw)         | Call",
            "f(1, *a, k=2, **kw) | Call",
            "1 if a else 2   | IfExp"
    })
    public void testUnsupportedExpressions(String source, String kind) {
        assertEquals(new SyntaxNode.Unsupported(kind), expression(source + "\n"));
    }

    @Test
    public void testBitwisePrecedence() {
        SyntaxNode expected = new SyntaxNode.BinOp(name("a"), BinaryOperator.BIT_OR,
                new SyntaxNode.BinOp(
                        new SyntaxNode.BinOp(name("b"), BinaryOperator.BIT_XOR,
                                new SyntaxNode.BinOp(name("c"), BinaryOperator.BIT_AND, name("d"))),
                        BinaryOperator.BIT_XOR, name("e")));

        assertEquals(expected, expression("a | b ^ c & d ^ e\n"));
    }

    @Test
    public void testKeywordDirectlyBeforeString() {
        assertEquals(new SyntaxNode.Return(SyntaxNode.Constant.of("s")), single("return\"s\"\n"));
    }

    @Test
    public void testUnsupportedNodeInsideFunctionKeepsSiblings() {
        SyntaxNode.FunctionDef def = (SyntaxNode.FunctionDef) single(
                "def f(x):\n    while x > 0:\n        x = x - 1\n    return x\n");

        assertEquals(Lists.immutable.of(new SyntaxNode.Unsupported("While"), new SyntaxNode.Return(name("x"))), def.body());
    }

    // ============================================================
    // Malformed input
    // ============================================================

    @Test
    public void testMissingColumn() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("def f(x)\n    return x\n"));

        assertEquals(1, e.getLine());
        assertEquals(9, e.getColumn());
        assertEquals("def f(x)", e.getText());
        assertTrue(e.getMessage().contains("Expected ':'"));
    }

    @Test
    public void testUnexpectedIndent() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("x = 1\n    y = 2\n"));

        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().contains("unexpected indent"));
    }

    @Test
    public void testMissingIndentedBlock() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("if x:\nreturn 1\n"));

        assertEquals(2, e.getLine());
    }

    @Test
    public void testUnsupportedStatementKeyword() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("x = 1\nclass A:\n    pass\n"));

        assertEquals(2, e.getLine());
        assertEquals(1, e.getColumn());
        assertTrue(e.getMessage().contains("class"));
    }

    @Test
    public void testAssignmentToExpression() {
        assertThrows(ParseException.class, () -> parser.parse("1 = x\n"));
        assertThrows(ParseException.class, () -> parser.parse("True = x\n"));
    }

    @Test
    public void testIncompleteExpression() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("x = 1 +\n"));

        assertEquals(1, e.getLine());
        assertTrue(e.hasPosition());
    }

    @Test
    public void testLeadingZeroInteger() {
        assertThrows(ParseException.class, () -> parser.parse("x = 012\n"));
    }
}
