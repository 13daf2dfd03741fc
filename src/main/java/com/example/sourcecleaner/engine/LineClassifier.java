package com.example.sourcecleaner.engine;

import com.example.sourcecleaner.domain.LineRole;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Decides what a physical line is from the line and the line before it. No other context is
 * consulted, so anything that might belong to a statement spanning several lines is reported
 * as {@link LineRole#CONTINUATION} and left alone by the rewriters.
 */
@Component
public class LineClassifier {
    public static final String PLACEHOLDER = "pass";

    private static final Pattern EXCEPT_BINDING =
            Pattern.compile("^\\s*except [\\s,()\\w]+ as \\w+:$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern IMPORT_STATEMENT = Pattern.compile("^\\s*(?:import|from)\\s");
    private static final Pattern FROM_IMPORT = Pattern.compile("^\\s*from\\s");
    private static final Pattern IDENTIFIER = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private final PythonTokenizer tokenizer;

    public LineClassifier(PythonTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public LineRole classify(String line, String previousLine) {
        if (line.indexOf('#') >= 0) {
            return LineRole.COMMENT;
        }
        if (EXCEPT_BINDING.matcher(withoutTerminator(line)).matches()) {
            return LineRole.EXCEPT_BINDING;
        }
        if (IMPORT_STATEMENT.matcher(line).lookingAt()) {
            if (isMultilineImport(line, previousLine)) {
                return LineRole.CONTINUATION;
            }
            return FROM_IMPORT.matcher(line).lookingAt() ? LineRole.FROM_IMPORT : LineRole.PLAIN_IMPORT;
        }
        if (isMultilineStatement(line, previousLine)) {
            return LineRole.CONTINUATION;
        }
        if (isSingleAssignment(line)) {
            return LineRole.ASSIGNMENT;
        }
        return LineRole.OTHER;
    }

    public boolean isMultilineImport(String line, String previousLine) {
        if (line.indexOf('(') >= 0 || line.indexOf(')') >= 0) {
            return true;
        }
        // Doctest prompt.
        if (line.stripLeading().startsWith(">")) {
            return true;
        }
        return isMultilineStatement(line, previousLine);
    }

    public boolean isMultilineStatement(String line, String previousLine) {
        for (char symbol : new char[] {'\\', ':', ';'}) {
            if (line.indexOf(symbol) >= 0) {
                return true;
            }
        }
        try {
            tokenizer.tokenize(line);
        } catch (TokenizeException e) {
            return true;
        }
        return previousLine != null && previousLine.stripTrailing().endsWith("\\");
    }

    /** {@code name = value} with exactly one {@code =} and a plain identifier on the left. */
    private boolean isSingleAssignment(String line) {
        int equals = line.indexOf('=');
        if (equals < 0 || line.indexOf('=', equals + 1) >= 0) {
            return false;
        }
        return IDENTIFIER.matcher(line.substring(0, equals).strip()).matches();
    }

    public static String indentation(String line) {
        if (line.isBlank()) {
            return "";
        }
        return line.substring(0, line.length() - line.stripLeading().length());
    }

    /** Trailing whitespace of the line, terminator included; empty for an unterminated line. */
    public static String lineEnding(String line) {
        return line.substring(line.stripTrailing().length());
    }

    /** A placeholder statement that keeps the indentation and ending of {@code line}. */
    public static String placeholderFor(String line) {
        return indentation(line) + PLACEHOLDER + lineEnding(line);
    }

    static String withoutTerminator(String line) {
        if (line.endsWith("\r\n")) {
            return line.substring(0, line.length() - 2);
        }
        if (line.endsWith("\n")) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }
}
