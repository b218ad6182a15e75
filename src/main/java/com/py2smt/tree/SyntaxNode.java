package com.py2smt.tree;

import org.eclipse.collections.api.list.ImmutableList;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Generic syntax tree of the supported Python subset.
 * <p>
 * Nodes are immutable values. A frontend builds the tree once, a translator walks it
 * read-only through {@link Visitor}, which has one method per node kind so that a new kind
 * cannot be added without every translator handling it.
 */
public sealed interface SyntaxNode {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitModule(Module module);
        R visitFunctionDef(FunctionDef functionDef);
        R visitAssign(Assign assign);
        R visitBinOp(BinOp binOp);
        R visitCompare(Compare compare);
        R visitBoolOp(BoolOp boolOp);
        R visitUnaryOp(UnaryOp unaryOp);
        R visitIf(If ifNode);
        R visitReturn(Return returnNode);
        R visitName(Name name);
        R visitConstant(Constant constant);
        R visitExpr(Expr expr);
        R visitUnsupported(Unsupported unsupported);
    }

    record Module(ImmutableList<SyntaxNode> statements) implements SyntaxNode {
        public Module {
            Objects.requireNonNull(statements, "statements");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitModule(this);
        }
    }

    record FunctionDef(String name, ImmutableList<String> params, ImmutableList<SyntaxNode> body) implements SyntaxNode {
        public FunctionDef {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(params, "params");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }
    }

    // Targets are Name nodes; the frontends reject anything else.
    record Assign(ImmutableList<SyntaxNode> targets, SyntaxNode value) implements SyntaxNode {
        public Assign {
            Objects.requireNonNull(targets, "targets");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    record BinOp(SyntaxNode left, BinaryOperator op, SyntaxNode right) implements SyntaxNode {
        public BinOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinOp(this);
        }
    }

    record Compare(SyntaxNode left, ImmutableList<CompareOperator> ops, ImmutableList<SyntaxNode> comparators)
            implements SyntaxNode {
        public Compare {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(ops, "ops");
            Objects.requireNonNull(comparators, "comparators");
            if (ops.isEmpty() || ops.size() != comparators.size()) {
                throw new IllegalArgumentException("Compare needs one comparator per operator, got "
                        + ops.size() + " operators and " + comparators.size() + " comparators");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCompare(this);
        }
    }

    record BoolOp(BooleanOperator op, ImmutableList<SyntaxNode> values) implements SyntaxNode {
        public BoolOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(values, "values");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolOp(this);
        }
    }

    record UnaryOp(UnaryOperator op, SyntaxNode operand) implements SyntaxNode {
        public UnaryOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    record If(SyntaxNode test, ImmutableList<SyntaxNode> body, ImmutableList<SyntaxNode> orelse) implements SyntaxNode {
        public If {
            Objects.requireNonNull(test, "test");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(orelse, "orelse");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    /** A return statement; {@code value} is null for a bare {@code return}. */
    record Return(SyntaxNode value) implements SyntaxNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    record Name(String identifier) implements SyntaxNode {
        public Name {
            Objects.requireNonNull(identifier, "identifier");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    record Expr(SyntaxNode value) implements SyntaxNode {
        public Expr {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpr(this);
        }
    }

    /**
     * A construct the frontend recognised but no translator supports, named by its Python
     * ast kind ({@code While}, {@code Call}, {@code AugAssign}, ...).
     */
    record Unsupported(String kind) implements SyntaxNode {
        public Unsupported {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnsupported(this);
        }
    }

    sealed interface Constant extends SyntaxNode {
        @Override
        default <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }

        record IntConstant(BigInteger value) implements Constant {
            public IntConstant {
                Objects.requireNonNull(value, "value");
            }

            public String canonicalText() {
                return value.toString();
            }
        }

        record FloatConstant(double value) implements Constant {
            public String canonicalText() {
                return FloatFormat.pythonRepr(value);
            }
        }

        record StrConstant(String value) implements Constant {
            public StrConstant {
                Objects.requireNonNull(value, "value");
            }
        }

        static Constant of(long value) {
            return new IntConstant(BigInteger.valueOf(value));
        }

        static Constant of(BigInteger value) {
            return new IntConstant(value);
        }

        static Constant of(double value) {
            return new FloatConstant(value);
        }

        static Constant of(String value) {
            return new StrConstant(value);
        }
    }
}
