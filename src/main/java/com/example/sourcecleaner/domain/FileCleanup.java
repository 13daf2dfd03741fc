package com.example.sourcecleaner.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Cleanup outcome for a single file.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class FileCleanup {
    private String name;
    private String encoding;
    private boolean changed;
    private int iterations;
    private String cleanedSource;
    private String diff;
}
