package com.example.sourcecleaner.domain;

import java.nio.charset.Charset;
import java.util.Objects;

/** Source text together with what is needed to write it back in its original encoding. */
public record DecodedSource(String text, Charset charset, boolean byteOrderMark) {
    public DecodedSource {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(charset, "charset");
    }
}
