package com.example.sourcecleaner.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-facing switches for one cleanup run.
 *
 * @param additionalImports modules to treat as safe on top of the standard library
 * @param removeAllUnusedImports remove unused imports regardless of the module
 * @param removeUnusedVariables also rewrite unused local bindings
 */
public record CleanupOptions(
        List<String> additionalImports,
        boolean removeAllUnusedImports,
        boolean removeUnusedVariables) {
    public static final String REDUNDANT_OPTIONS_MESSAGE =
            "Using both --remove-all and --imports is redundant";

    public CleanupOptions {
        additionalImports = additionalImports == null ? List.of() : List.copyOf(additionalImports);
        if (removeAllUnusedImports && !additionalImports.isEmpty()) {
            throw new IllegalArgumentException(REDUNDANT_OPTIONS_MESSAGE);
        }
    }

    public static CleanupOptions defaults() {
        return new CleanupOptions(List.of(), false, false);
    }

    /** Splits a comma-separated module list, dropping blank entries. */
    public static List<String> parseImports(String csv) {
        List<String> names = new ArrayList<>();
        if (csv == null) {
            return names;
        }
        for (String part : csv.split(",")) {
            String name = part.strip();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
