package com.example.sourcecleaner.engine;

/**
 * @param row 1-based row the token starts on
 * @param column 0-based column the token starts at
 * @param line physical line(s) the token was read from
 */
public record PythonToken(TokenType type, String text, int row, int column, String line) {
    public boolean isOp(String op) {
        return type == TokenType.OP && text.equals(op);
    }
}
