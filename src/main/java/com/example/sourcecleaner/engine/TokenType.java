package com.example.sourcecleaner.engine;

public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    COMMENT,
    NL,
    NEWLINE,
    INDENT,
    DEDENT,
    ENDMARKER;

    /** Identifiers, numbers and strings: tokens that can start an expression statement. */
    public boolean isAtom() {
        return this == NAME || this == NUMBER || this == STRING;
    }

    /** Tokens that carry source text rather than layout. */
    public boolean isReal() {
        return isAtom() || this == OP;
    }
}
