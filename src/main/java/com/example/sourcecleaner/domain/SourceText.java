package com.example.sourcecleaner.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Physical lines of a source buffer, each one keeping its own trailing {@code \n}.
 * The last line has no terminator when the buffer does not end with one.
 */
public final class SourceText {
    private final List<String> lines;

    private SourceText(List<String> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    public static SourceText of(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int newline;
        while ((newline = text.indexOf('\n', start)) >= 0) {
            lines.add(text.substring(start, newline + 1));
            start = newline + 1;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return new SourceText(lines);
    }

    public List<String> lines() {
        return lines;
    }

    public int lineCount() {
        return lines.size();
    }

    /** Returns the 1-based line {@code number}. */
    public String line(int number) {
        return lines.get(number - 1);
    }

    public String text() {
        return String.join("", lines);
    }

    @Override
    public String toString() {
        return text();
    }
}
