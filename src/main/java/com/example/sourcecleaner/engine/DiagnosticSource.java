package com.example.sourcecleaner.engine;

import com.example.sourcecleaner.domain.Diagnostic;

import java.util.List;

/**
 * Produces unused-import and unused-variable findings for a source buffer. Line numbers in
 * the result refer to exactly the {@code source} passed in.
 */
@FunctionalInterface
public interface DiagnosticSource {
    List<Diagnostic> diagnose(String source) throws DiagnosticSourceException;
}
