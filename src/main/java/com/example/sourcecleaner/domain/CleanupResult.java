package com.example.sourcecleaner.domain;

/** Outcome of driving one source buffer to its fixed point. */
public record CleanupResult(String original, String cleaned, int iterations) {
    public boolean isChanged() {
        return !original.equals(cleaned);
    }
}
