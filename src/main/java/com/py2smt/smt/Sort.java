package com.py2smt.smt;

/** SMT-LIB2 sort applied to every parameter and to the result of a translated function. */
public enum Sort {
    INT("Int"),
    BOOL("Bool");

    private final String smtName;

    Sort(String smtName) {
        this.smtName = smtName;
    }

    public String smtName() {
        return smtName;
    }

    /** Accepts {@code Int}/{@code Bool} (any case) as well as the constant names. */
    public static Sort parse(String text) {
        for (Sort sort : values()) {
            if (sort.smtName.equalsIgnoreCase(text) || sort.name().equalsIgnoreCase(text)) {
                return sort;
            }
        }
        throw new IllegalArgumentException("Unsupported sort: " + text + " (expected Int or Bool)");
    }

    @Override
    public String toString() {
        return smtName;
    }
}
