package com.example.sourcecleaner.domain;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * A zip archive of sources to clean, independent of where the bytes come from.
 */
public record ArchiveInput(String name, StreamOpener opener) {
    public ArchiveInput {
        name = name != null ? name : "";
        Objects.requireNonNull(opener, "opener");
    }

    public static ArchiveInput ofBytes(String name, byte[] zipBytes) {
        byte[] copy = zipBytes.clone();
        return new ArchiveInput(name, () -> new ByteArrayInputStream(copy));
    }

    public InputStream openStream() throws IOException {
        return opener.open();
    }

    @FunctionalInterface
    public interface StreamOpener {
        InputStream open() throws IOException;
    }
}
