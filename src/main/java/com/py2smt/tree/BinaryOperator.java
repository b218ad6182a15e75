package com.py2smt.tree;

import java.util.Arrays;
import java.util.Optional;

/** Binary arithmetic operators, named after their Python ast classes. */
public enum BinaryOperator {
    ADD("Add", "+"),
    SUB("Sub", "-"),
    MULT("Mult", "*"),
    DIV("Div", "/"),
    MOD("Mod", "%"),
    FLOOR_DIV("FloorDiv", "//"),
    POW("Pow", "**"),
    MAT_MULT("MatMult", "@"),
    L_SHIFT("LShift", "<<"),
    R_SHIFT("RShift", ">>"),
    BIT_OR("BitOr", "|"),
    BIT_XOR("BitXor", "^"),
    BIT_AND("BitAnd", "&");

    private final String astName;
    private final String token;

    BinaryOperator(String astName, String token) {
        this.astName = astName;
        this.token = token;
    }

    public String astName() {
        return astName;
    }

    public String token() {
        return token;
    }

    public static Optional<BinaryOperator> fromAstName(String name) {
        return Arrays.stream(values()).filter(op -> op.astName.equals(name)).findFirst();
    }

    public static Optional<BinaryOperator> fromToken(String token) {
        return Arrays.stream(values()).filter(op -> op.token.equals(token)).findFirst();
    }
}
