package com.example.sourcecleaner.application;

public interface DiffRenderer {
    /** Unified diff of {@code original} against {@code revised}; empty when they are equal. */
    String render(String fileName, String original, String revised, int contextSize);
}
