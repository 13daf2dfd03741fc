package com.example.sourcecleaner.domain;

import java.util.Objects;

/**
 * A single analyzer finding. {@code line} is 1-based and only valid against the exact text
 * the analyzer was run on. {@code symbol} may be null.
 */
public record Diagnostic(DiagnosticKind kind, int line, String symbol) {
    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        if (line < 1) {
            throw new IllegalArgumentException("Line numbers are 1-based, got " + line);
        }
    }

    public static Diagnostic unusedImport(int line, String symbol) {
        return new Diagnostic(DiagnosticKind.UNUSED_IMPORT, line, symbol);
    }

    public static Diagnostic unusedVariable(int line, String symbol) {
        return new Diagnostic(DiagnosticKind.UNUSED_VARIABLE, line, symbol);
    }
}
