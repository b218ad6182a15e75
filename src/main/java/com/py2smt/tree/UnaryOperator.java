package com.py2smt.tree;

import java.util.Arrays;
import java.util.Optional;

public enum UnaryOperator {
    NOT("Not"),
    U_SUB("USub"),
    U_ADD("UAdd"),
    INVERT("Invert");

    private final String astName;

    UnaryOperator(String astName) {
        this.astName = astName;
    }

    public String astName() {
        return astName;
    }

    public static Optional<UnaryOperator> fromAstName(String name) {
        return Arrays.stream(values()).filter(op -> op.astName.equals(name)).findFirst();
    }
}
