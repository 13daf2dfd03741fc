package com.example.sourcecleaner.domain;

public enum DiagnosticKind {
    UNUSED_IMPORT,
    UNUSED_VARIABLE
}
