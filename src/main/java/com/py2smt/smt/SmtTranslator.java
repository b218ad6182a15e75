package com.py2smt.smt;

import com.py2smt.tree.BinaryOperator;
import com.py2smt.tree.BooleanOperator;
import com.py2smt.tree.CompareOperator;
import com.py2smt.tree.SyntaxNode;
import com.py2smt.tree.SyntaxNode.Constant;
import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Translates a {@link SyntaxNode} tree into SMT-LIB2 text.
 * <p>
 * The output holds one fragment per top-level statement, separated by newlines, with no
 * solver harness around it. Assignments become textual {@code (let x v)} fragments and
 * {@code if/elif/else} becomes right-nested {@code ite} forms.
 * <p>
 * Node kinds and operators without an SMT rendering are emitted as
 * {@code UNKNOWN_TYPE_<name>} markers, or rejected with
 * {@link UnsupportedConstructException} when the translator is strict. Instances hold no
 * mutable state and can be shared between threads.
 */
public class SmtTranslator {
    private static final Logger logger = LoggerFactory.getLogger(SmtTranslator.class);

    static final String UNKNOWN_PREFIX = "UNKNOWN_TYPE_";

    private static final Map<BinaryOperator, String> ARITHMETIC_SYMBOLS = new EnumMap<>(BinaryOperator.class);
    private static final Map<CompareOperator, String> COMPARISON_SYMBOLS = new EnumMap<>(CompareOperator.class);

    static {
        ARITHMETIC_SYMBOLS.put(BinaryOperator.ADD, "+");
        ARITHMETIC_SYMBOLS.put(BinaryOperator.SUB, "-");
        ARITHMETIC_SYMBOLS.put(BinaryOperator.MULT, "*");
        ARITHMETIC_SYMBOLS.put(BinaryOperator.DIV, "div");
        ARITHMETIC_SYMBOLS.put(BinaryOperator.MOD, "mod");

        COMPARISON_SYMBOLS.put(CompareOperator.EQ, "=");
        COMPARISON_SYMBOLS.put(CompareOperator.LT, "<");
        COMPARISON_SYMBOLS.put(CompareOperator.LT_E, "<=");
        COMPARISON_SYMBOLS.put(CompareOperator.GT, ">");
        COMPARISON_SYMBOLS.put(CompareOperator.GT_E, ">=");
    }

    private final boolean strict;

    public SmtTranslator() {
        this(false);
    }

    public SmtTranslator(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    public String translate(SyntaxNode tree, Sort sort) {
        logger.debug("Translating {} with result sort {}", tree.getClass().getSimpleName(), sort);
        return tree.accept(new Emitter(sort));
    }

    private String unsupported(UnsupportedConstructException.Kind kind, String construct) {
        if (strict) {
            throw new UnsupportedConstructException(kind, construct);
        }
        logger.warn("No SMT-LIB2 rendering for {} {}, emitting marker", kind.name().toLowerCase(Locale.ROOT), construct);
        return UNKNOWN_PREFIX + construct;
    }

    private final class Emitter implements SyntaxNode.Visitor<String> {
        private final String sortName;

        Emitter(Sort sort) {
            this.sortName = sort.smtName();
        }

        private String emit(SyntaxNode node) {
            return node.accept(this);
        }

        private String block(ImmutableList<SyntaxNode> statements) {
            return statements.collect(this::emit).makeString("\n");
        }

        @Override
        public String visitModule(SyntaxNode.Module module) {
            return block(module.statements());
        }

        @Override
        public String visitFunctionDef(SyntaxNode.FunctionDef functionDef) {
            String params = functionDef.params()
                    .collect(param -> "(" + param + " " + sortName + ")")
                    .makeString(" ");
            return "(define-fun " + functionDef.name() + " (" + params + ") " + sortName + " "
                    + block(functionDef.body()) + ")";
        }

        @Override
        public String visitAssign(SyntaxNode.Assign assign) {
            String targets = assign.targets().collect(this::emit).makeString(" ");
            return "(let " + targets + " " + emit(assign.value()) + ")";
        }

        @Override
        public String visitBinOp(SyntaxNode.BinOp binOp) {
            String symbol = ARITHMETIC_SYMBOLS.get(binOp.op());
            if (symbol == null) {
                symbol = unsupported(UnsupportedConstructException.Kind.OPERATOR, binOp.op().astName());
            }
            return "(" + symbol + " " + emit(binOp.left()) + " " + emit(binOp.right()) + ")";
        }

        @Override
        public String visitCompare(SyntaxNode.Compare compare) {
            String left = emit(compare.left());
            // Any != reduces the chain to one negated equality against the first comparator.
            if (compare.ops().contains(CompareOperator.NOT_EQ)) {
                return "(not (= " + left + " " + emit(compare.comparators().getFirst()) + "))";
            }
            String ops = compare.ops().collect(op -> {
                String symbol = COMPARISON_SYMBOLS.get(op);
                return symbol != null ? symbol : unsupported(UnsupportedConstructException.Kind.OPERATOR, op.astName());
            }).makeString(" ");
            String comparators = compare.comparators().collect(this::emit).makeString(" ");
            return "(" + ops + " " + left + " " + comparators + ")";
        }

        @Override
        public String visitBoolOp(SyntaxNode.BoolOp boolOp) {
            String op = boolOp.op() == BooleanOperator.AND ? "and" : "or";
            return "(" + op + " " + boolOp.values().collect(this::emit).makeString(" ") + ")";
        }

        @Override
        public String visitUnaryOp(SyntaxNode.UnaryOp unaryOp) {
            return switch (unaryOp.op()) {
                case NOT -> "(not " + emit(unaryOp.operand()) + ")";
                case U_SUB -> "(- " + emit(unaryOp.operand()) + ")";
                default -> unsupported(UnsupportedConstructException.Kind.OPERATOR, "UnaryOp_" + unaryOp.op().astName());
            };
        }

        @Override
        public String visitIf(SyntaxNode.If ifNode) {
            return "(ite " + emit(ifNode.test()) + " " + block(ifNode.body()) + " " + block(ifNode.orelse()) + ")";
        }

        @Override
        public String visitReturn(SyntaxNode.Return returnNode) {
            return returnNode.value() != null ? emit(returnNode.value()) : "nil";
        }

        @Override
        public String visitName(SyntaxNode.Name name) {
            String lowered = name.identifier().toLowerCase(Locale.ROOT);
            if (lowered.equals("true") || lowered.equals("false")) {
                return lowered;
            }
            return name.identifier();
        }

        @Override
        public String visitConstant(Constant constant) {
            if (constant instanceof Constant.IntConstant intConstant) {
                return intConstant.canonicalText();
            }
            if (constant instanceof Constant.FloatConstant floatConstant) {
                return floatConstant.canonicalText();
            }
            return "\"" + ((Constant.StrConstant) constant).value() + "\"";
        }

        @Override
        public String visitExpr(SyntaxNode.Expr expr) {
            return emit(expr.value());
        }

        @Override
        public String visitUnsupported(SyntaxNode.Unsupported unsupported) {
            return unsupported(UnsupportedConstructException.Kind.NODE, unsupported.kind());
        }
    }
}
