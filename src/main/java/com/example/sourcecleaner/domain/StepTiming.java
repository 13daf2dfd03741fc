package com.example.sourcecleaner.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Elapsed time of one cleanup step and the number of files it touched.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StepTiming {
    private String label;
    private int fileCount;
    private double durationSeconds;
}
