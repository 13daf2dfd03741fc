package com.example.sourcecleaner.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Module and package names whose unused imports may be removed without changing program
 * behaviour. Instances are immutable and shared across cleanups.
 */
public final class SafeSymbolRegistry {
    /** Standard-library modules that do something observable when imported. */
    public static final Set<String> IMPORTS_WITH_SIDE_EFFECTS =
            Set.of("antigravity", "rlcompleter", "this");

    /** Modules that may be compiled into the interpreter and so never show up on disk. */
    public static final Set<String> BINARY_IMPORTS =
            Set.of(
                    "datetime", "grp", "io", "json", "math", "multiprocessing", "parser",
                    "pwd", "string", "operator", "os", "sys", "time");

    private final Set<String> names;

    private SafeSymbolRegistry(Set<String> names) {
        this.names = Collections.unmodifiableSet(names);
    }

    public static SafeSymbolRegistry of(Collection<String> names) {
        return new SafeSymbolRegistry(new TreeSet<>(names));
    }

    public static SafeSymbolRegistry fromStandardLibrary(Collection<String> standardLibraryNames) {
        Set<String> safe = new TreeSet<>(standardLibraryNames);
        safe.removeAll(IMPORTS_WITH_SIDE_EFFECTS);
        safe.addAll(BINARY_IMPORTS);
        return new SafeSymbolRegistry(safe);
    }

    public SafeSymbolRegistry withAdditional(Collection<String> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        Set<String> merged = new TreeSet<>(names);
        merged.addAll(additional);
        return new SafeSymbolRegistry(merged);
    }

    public boolean contains(String name) {
        return name != null && names.contains(name);
    }

    public Set<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }
}
