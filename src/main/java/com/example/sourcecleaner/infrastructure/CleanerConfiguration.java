package com.example.sourcecleaner.infrastructure;

import com.example.sourcecleaner.domain.CleanupOptions;
import com.example.sourcecleaner.domain.SafeSymbolRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

@Configuration
public class CleanerConfiguration {
    private static final Logger log = LogManager.getLogger(CleanerConfiguration.class);

    @Bean
    public SafeSymbolRegistry safeSymbolRegistry(
            StandardLibraryCatalog catalog,
            @Value("${cleaner.safe-imports.stdlib-path:}") String standardLibraryPath,
            @Value("${cleaner.safe-imports.additional:}") String additional)
            throws IOException {
        Set<String> standardLibrary;
        if (standardLibraryPath.isBlank()) {
            standardLibrary = catalog.bundled();
        } else {
            standardLibrary = catalog.scan(Path.of(standardLibraryPath.strip()));
        }
        SafeSymbolRegistry registry =
                SafeSymbolRegistry.fromStandardLibrary(standardLibrary)
                        .withAdditional(CleanupOptions.parseImports(additional));
        log.info(
                "Loaded {} safe import names from {}",
                registry.size(),
                standardLibraryPath.isBlank() ? "bundled module list" : standardLibraryPath);
        return registry;
    }
}
