package com.example.sourcecleaner.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Holds the per-file results of an archive cleanup.
 */
@Getter
@Setter
@NoArgsConstructor
public class CleanupReport {
    private String archiveName;
    private List<FileCleanup> changed;
    private List<String> unchanged;
    private List<StepTiming> steps;
    private double totalDurationSeconds;

    public CleanupReport(String archiveName, List<FileCleanup> changed, List<String> unchanged) {
        this.archiveName = archiveName;
        this.changed = changed;
        this.unchanged = unchanged;
    }
}
