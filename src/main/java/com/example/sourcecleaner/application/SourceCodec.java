package com.example.sourcecleaner.application;

import com.example.sourcecleaner.domain.DecodedSource;

/**
 * Converts source files between bytes and text, keeping track of the encoding so that a
 * rewritten file can be written back the way it was read.
 */
public interface SourceCodec {
    DecodedSource decode(byte[] content);

    byte[] encode(DecodedSource original, String text);
}
