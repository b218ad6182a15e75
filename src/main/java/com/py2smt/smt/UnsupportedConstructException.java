package com.py2smt.smt;

/**
 * Raised by a strict {@link SmtTranslator} when the tree holds a node kind or operator that
 * has no SMT-LIB2 rendering.
 */
public class UnsupportedConstructException extends RuntimeException {

    public enum Kind {
        NODE,
        OPERATOR
    }

    private final Kind kind;
    private final String construct;

    public UnsupportedConstructException(Kind kind, String construct) {
        super(String.format("Unsupported %s: %s", kind == Kind.NODE ? "node kind" : "operator", construct));
        this.kind = kind;
        this.construct = construct;
    }

    public Kind getKind() {
        return kind;
    }

    public String getConstruct() {
        return construct;
    }
}
