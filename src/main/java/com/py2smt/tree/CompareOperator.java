package com.py2smt.tree;

import java.util.Arrays;
import java.util.Optional;

/** Comparison operators, named after their Python ast classes. */
public enum CompareOperator {
    EQ("Eq"),
    NOT_EQ("NotEq"),
    LT("Lt"),
    LT_E("LtE"),
    GT("Gt"),
    GT_E("GtE"),
    IS("Is"),
    IS_NOT("IsNot"),
    IN("In"),
    NOT_IN("NotIn");

    private final String astName;

    CompareOperator(String astName) {
        this.astName = astName;
    }

    public String astName() {
        return astName;
    }

    public static Optional<CompareOperator> fromAstName(String name) {
        return Arrays.stream(values()).filter(op -> op.astName.equals(name)).findFirst();
    }
}
