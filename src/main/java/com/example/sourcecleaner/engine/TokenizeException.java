package com.example.sourcecleaner.engine;

/** Raised when source text cannot be split into tokens. */
public class TokenizeException extends Exception {
    private final int row;

    public TokenizeException(String message, int row) {
        super(message + " (line " + row + ")");
        this.row = row;
    }

    public int getRow() {
        return row;
    }
}
