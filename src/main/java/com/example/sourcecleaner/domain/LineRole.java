package com.example.sourcecleaner.domain;

/** Role of a physical line, derived from the line and its predecessor only. */
public enum LineRole {
    COMMENT,
    CONTINUATION,
    PLAIN_IMPORT,
    FROM_IMPORT,
    ASSIGNMENT,
    EXCEPT_BINDING,
    OTHER;

    public boolean isImport() {
        return this == PLAIN_IMPORT || this == FROM_IMPORT;
    }
}
