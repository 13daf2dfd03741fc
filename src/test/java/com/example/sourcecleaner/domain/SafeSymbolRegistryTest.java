package com.example.sourcecleaner.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SafeSymbolRegistryTest {

    @Test
    void standardLibraryExcludesModulesWithSideEffects() {
        SafeSymbolRegistry registry =
                SafeSymbolRegistry.fromStandardLibrary(List.of("abc", "antigravity", "this", "rlcompleter"));

        assertTrue(registry.contains("abc"));
        assertFalse(registry.contains("antigravity"));
        assertFalse(registry.contains("this"));
        assertFalse(registry.contains("rlcompleter"));
    }

    @Test
    void builtinModulesAreAlwaysSafe() {
        SafeSymbolRegistry registry = SafeSymbolRegistry.fromStandardLibrary(List.of());

        assertThat(registry.names()).containsAll(SafeSymbolRegistry.BINARY_IMPORTS);
        assertThat(registry.size()).isEqualTo(SafeSymbolRegistry.BINARY_IMPORTS.size());
    }

    @Test
    void additionalNamesExtendACopy() {
        SafeSymbolRegistry base = SafeSymbolRegistry.of(List.of("os"));
        SafeSymbolRegistry extended = base.withAdditional(List.of("requests"));

        assertTrue(extended.contains("requests"));
        assertFalse(base.contains("requests"));
        assertSame(base, base.withAdditional(List.of()));
        assertFalse(base.contains(null));
    }
}
