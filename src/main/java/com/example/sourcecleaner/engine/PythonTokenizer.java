package com.example.sourcecleaner.engine;

import com.example.sourcecleaner.domain.SourceText;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Python source into the token stream Python's own {@code tokenize} module produces,
 * with the same INDENT/DEDENT/NEWLINE/NL layout tokens. Only what the line rewriters and the
 * pass compactor rely on is modelled; anything the tokenizer cannot account for is reported
 * as a {@link TokenizeException} rather than guessed at.
 */
@Component
public class PythonTokenizer {
    private static final int TAB_SIZE = 8;
    private static final String STRING_PREFIX_CHARS = "rRbBuUfF";

    private static final Pattern NUMBER =
            Pattern.compile(
                    "0[xX](?:_?[0-9a-fA-F])+"
                            + "|0[bB](?:_?[01])+"
                            + "|0[oO](?:_?[0-7])+"
                            + "|(?:(?:[0-9](?:_?[0-9])*)?\\.[0-9](?:_?[0-9])*|[0-9](?:_?[0-9])*\\.?)"
                            + "(?:[eE][-+]?[0-9](?:_?[0-9])*)?[jJ]?");

    // Longest first, so that the first prefix match is the right one.
    private static final List<String> OPERATORS =
            List.of(
                    "**=", "//=", ">>=", "<<=", "...",
                    "**", "//", ">>", "<<", "<=", ">=", "==", "!=", "->", "+=", "-=", "*=",
                    "/=", "%=", "&=", "|=", "^=", "@=", ":=",
                    "+", "-", "*", "/", "%", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]",
                    "{", "}", ",", ":", ";", ".", "=", "@", "!");

    public List<PythonToken> tokenize(String source) throws TokenizeException {
        return new Run(SourceText.of(source).lines()).tokenize();
    }

    private static final class Run {
        private final List<String> lines;
        private final List<PythonToken> tokens = new ArrayList<>();
        private final Deque<Integer> indents = new ArrayDeque<>();
        private int parenLevel;
        private boolean continued;
        private PendingString pending;

        private Run(List<String> lines) {
            this.lines = lines;
        }

        List<PythonToken> tokenize() throws TokenizeException {
            indents.push(0);
            int row = 0;
            for (String line : lines) {
                row++;
                int pos = 0;
                if (pending != null) {
                    int end = closingQuote(line, 0, pending.delimiter, row);
                    if (end < 0) {
                        pending.append(line);
                        continue;
                    }
                    tokens.add(pending.finish(line, end));
                    pending = null;
                    pos = end;
                } else if (parenLevel == 0 && !continued) {
                    pos = startLogicalLine(line, row);
                    if (pos < 0) {
                        continue;
                    }
                } else {
                    continued = false;
                }
                scanTokens(line, row, pos);
            }
            finish(row);
            return tokens;
        }

        /** Handles indentation; returns -1 for blank and comment-only lines. */
        private int startLogicalLine(String line, int row) throws TokenizeException {
            int column = 0;
            int pos = 0;
            while (pos < line.length()) {
                char c = line.charAt(pos);
                if (c == ' ') {
                    column++;
                } else if (c == '\t') {
                    column = (column / TAB_SIZE + 1) * TAB_SIZE;
                } else if (c == '\f') {
                    column = 0;
                } else {
                    break;
                }
                pos++;
            }
            if (pos == line.length()) {
                return -1;
            }
            char c = line.charAt(pos);
            if (c == '#' || c == '\r' || c == '\n') {
                if (c == '#') {
                    int end = endOfContent(line, pos);
                    tokens.add(token(TokenType.COMMENT, line, pos, end, row));
                    pos = end;
                }
                if (pos < line.length()) {
                    tokens.add(token(TokenType.NL, line, pos, line.length(), row));
                }
                return -1;
            }
            if (column > indents.peek()) {
                indents.push(column);
                tokens.add(token(TokenType.INDENT, line, 0, pos, row));
            }
            while (column < indents.peek()) {
                indents.pop();
                if (column > indents.peek()) {
                    throw new TokenizeException(
                            "unindent does not match any outer indentation level", row);
                }
                tokens.add(new PythonToken(TokenType.DEDENT, "", row, pos, line));
            }
            return pos;
        }

        private void scanTokens(String line, int row, int start) throws TokenizeException {
            int pos = start;
            int max = line.length();
            while (pos < max) {
                char c = line.charAt(pos);
                if (c == ' ' || c == '\t' || c == '\f') {
                    pos++;
                } else if (c == '#') {
                    int end = endOfContent(line, pos);
                    tokens.add(token(TokenType.COMMENT, line, pos, end, row));
                    pos = end;
                } else if (c == '\r' || c == '\n') {
                    TokenType type = parenLevel > 0 ? TokenType.NL : TokenType.NEWLINE;
                    tokens.add(token(type, line, pos, max, row));
                    pos = max;
                } else if (c == '\\') {
                    if (endOfContent(line, pos + 1) != pos + 1) {
                        throw new TokenizeException(
                                "unexpected character after line continuation character", row);
                    }
                    continued = true;
                    pos = max;
                } else if (isDigit(c) || (c == '.' && pos + 1 < max && isDigit(line.charAt(pos + 1)))) {
                    Matcher matcher = NUMBER.matcher(line).region(pos, max);
                    if (!matcher.lookingAt()) {
                        throw new TokenizeException("invalid number literal", row);
                    }
                    tokens.add(token(TokenType.NUMBER, line, pos, matcher.end(), row));
                    pos = matcher.end();
                } else if (quoteIndex(line, pos) >= 0) {
                    pos = scanString(line, row, pos, quoteIndex(line, pos));
                } else if (isNameStart(c)) {
                    int end = pos + 1;
                    while (end < max && isNamePart(line.charAt(end))) {
                        end++;
                    }
                    tokens.add(token(TokenType.NAME, line, pos, end, row));
                    pos = end;
                } else {
                    String op = matchOperator(line, pos);
                    if (op == null) {
                        throw new TokenizeException("invalid character '" + c + "'", row);
                    }
                    trackBrackets(op, row);
                    tokens.add(token(TokenType.OP, line, pos, pos + op.length(), row));
                    pos += op.length();
                }
            }
        }

        private int scanString(String line, int row, int start, int quote) throws TokenizeException {
            char quoteChar = line.charAt(quote);
            String triple = String.valueOf(quoteChar).repeat(3);
            String delimiter = line.startsWith(triple, quote) ? triple : String.valueOf(quoteChar);
            int end = closingQuote(line, quote + delimiter.length(), delimiter, row);
            if (end >= 0) {
                tokens.add(token(TokenType.STRING, line, start, end, row));
                return end;
            }
            pending = new PendingString(delimiter, row, start, line.substring(start), line);
            return line.length();
        }

        private void trackBrackets(String op, int row) throws TokenizeException {
            if (op.length() != 1) {
                return;
            }
            if ("([{".indexOf(op.charAt(0)) >= 0) {
                parenLevel++;
            } else if (")]}".indexOf(op.charAt(0)) >= 0) {
                if (parenLevel == 0) {
                    throw new TokenizeException("unmatched '" + op + "'", row);
                }
                parenLevel--;
            }
        }

        private void finish(int lastRow) throws TokenizeException {
            if (pending != null) {
                throw new TokenizeException("EOF in multi-line string", pending.row);
            }
            if (parenLevel > 0 || continued) {
                throw new TokenizeException("EOF in multi-line statement", lastRow);
            }
            if (!tokens.isEmpty()) {
                PythonToken last = tokens.get(tokens.size() - 1);
                if (last.type().isReal() || (last.type() == TokenType.COMMENT && hasRealToken(last.row()))) {
                    tokens.add(new PythonToken(TokenType.NEWLINE, "", last.row(), last.line().length(), last.line()));
                } else if (last.type() == TokenType.COMMENT) {
                    tokens.add(new PythonToken(TokenType.NL, "", last.row(), last.line().length(), last.line()));
                }
            }
            while (indents.peek() > 0) {
                indents.pop();
                tokens.add(new PythonToken(TokenType.DEDENT, "", lastRow + 1, 0, ""));
            }
            tokens.add(new PythonToken(TokenType.ENDMARKER, "", lastRow + 1, 0, ""));
        }

        private boolean hasRealToken(int row) {
            return tokens.stream().anyMatch(t -> t.row() == row && t.type().isReal());
        }
    }

    private static final class PendingString {
        private final String delimiter;
        private final int row;
        private final int column;
        private final StringBuilder text;
        private final StringBuilder lines;

        private PendingString(String delimiter, int row, int column, String text, String line) {
            this.delimiter = delimiter;
            this.row = row;
            this.column = column;
            this.text = new StringBuilder(text);
            this.lines = new StringBuilder(line);
        }

        void append(String line) {
            text.append(line);
            lines.append(line);
        }

        PythonToken finish(String line, int end) {
            text.append(line, 0, end);
            lines.append(line);
            return new PythonToken(TokenType.STRING, text.toString(), row, column, lines.toString());
        }
    }

    /** Index just past the closing delimiter, or -1 when the string continues on the next line. */
    private static int closingQuote(String line, int from, String delimiter, int row)
            throws TokenizeException {
        boolean triple = delimiter.length() == 3;
        int i = from;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                i += line.startsWith("\r\n", i + 1) ? 3 : 2;
                continue;
            }
            if (line.startsWith(delimiter, i)) {
                return i + delimiter.length();
            }
            if (!triple && (c == '\n' || c == '\r')) {
                throw new TokenizeException("unterminated string literal", row);
            }
            i++;
        }
        return -1;
    }

    /** Index of the opening quote when a string literal starts at {@code pos}, else -1. */
    private static int quoteIndex(String line, int pos) {
        int i = pos;
        while (i < line.length() && i - pos < 2 && STRING_PREFIX_CHARS.indexOf(line.charAt(i)) >= 0) {
            i++;
        }
        if (i < line.length() && (line.charAt(i) == '\'' || line.charAt(i) == '"')) {
            return i;
        }
        return -1;
    }

    private static String matchOperator(String line, int pos) {
        for (String op : OPERATORS) {
            if (line.startsWith(op, pos)) {
                return op;
            }
        }
        return null;
    }

    private static int endOfContent(String line, int from) {
        int i = from;
        while (i < line.length() && line.charAt(i) != '\r' && line.charAt(i) != '\n') {
            i++;
        }
        return i;
    }

    private static PythonToken token(TokenType type, String line, int start, int end, int row) {
        return new PythonToken(type, line.substring(start, end), row, start, line);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNameStart(char c) {
        return c == '_' || Character.isLetter(c) || Character.isUnicodeIdentifierStart(c);
    }

    private static boolean isNamePart(char c) {
        return c == '_'
                || Character.isLetterOrDigit(c)
                || (Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c));
    }
}
