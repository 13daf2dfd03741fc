package com.example.sourcecleaner.engine;

/** The analyzer could not produce diagnostics for a source buffer. */
public class DiagnosticSourceException extends Exception {
    public DiagnosticSourceException(String message) {
        super(message);
    }

    public DiagnosticSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
