package com.example.sourcecleaner.domain;

import java.util.Objects;

public record CleanupRequest(ArchiveInput archive, CleanupOptions options, int contextSize) {
    public CleanupRequest {
        Objects.requireNonNull(archive, "archive");
        Objects.requireNonNull(options, "options");
    }
}
