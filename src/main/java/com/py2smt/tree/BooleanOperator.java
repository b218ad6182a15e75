package com.py2smt.tree;

import java.util.Arrays;
import java.util.Optional;

public enum BooleanOperator {
    AND("And"),
    OR("Or");

    private final String astName;

    BooleanOperator(String astName) {
        this.astName = astName;
    }

    public String astName() {
        return astName;
    }

    public static Optional<BooleanOperator> fromAstName(String name) {
        return Arrays.stream(values()).filter(op -> op.astName.equals(name)).findFirst();
    }
}
