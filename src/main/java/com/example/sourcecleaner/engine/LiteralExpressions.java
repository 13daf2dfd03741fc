package com.example.sourcecleaner.engine;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recognizes right-hand sides whose evaluation cannot have a side effect: constant literals
 * (the subset Python's {@code ast.literal_eval} accepts), the empty container constructors
 * and bare names.
 */
@Component
public class LiteralExpressions {
    private static final Set<String> EMPTY_CONSTRUCTORS = Set.of("dict()", "list()", "set()");
    private static final Set<String> CONSTANT_NAMES = Set.of("True", "False", "None");
    // No dots: an attribute access may run a property.
    private static final Pattern BARE_NAME = Pattern.compile("\\w+\\s*", Pattern.UNICODE_CHARACTER_CLASS);

    private final PythonTokenizer tokenizer;

    public LiteralExpressions(PythonTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public boolean isLiteralOrName(String value) {
        if (EMPTY_CONSTRUCTORS.contains(value.strip())) {
            return true;
        }
        if (BARE_NAME.matcher(value).matches()) {
            return true;
        }
        return isLiteral(value);
    }

    public boolean isLiteral(String value) {
        List<PythonToken> tokens;
        try {
            tokens =
                    tokenizer.tokenize(value).stream()
                            .filter(t -> t.type().isReal())
                            .collect(Collectors.toList());
        } catch (TokenizeException e) {
            return false;
        }
        return new Parser(tokens).parseLiteral();
    }

    private enum Kind {
        INVALID,
        NUMBER,
        OTHER
    }

    private static final class Parser {
        private final List<PythonToken> tokens;
        private int position;

        private Parser(List<PythonToken> tokens) {
            this.tokens = tokens;
        }

        boolean parseLiteral() {
            if (tokens.isEmpty()) {
                return false;
            }
            if (expression() == Kind.INVALID) {
                return false;
            }
            // A bare tuple: 1, 2
            while (accept(",")) {
                if (atEnd()) {
                    break;
                }
                if (expression() == Kind.INVALID) {
                    return false;
                }
            }
            return atEnd();
        }

        private Kind expression() {
            Kind left = signed();
            if (left == Kind.NUMBER && (peekOp("+") || peekOp("-"))) {
                position++;
                return signed() == Kind.NUMBER ? Kind.NUMBER : Kind.INVALID;
            }
            return left;
        }

        private Kind signed() {
            if (peekOp("+") || peekOp("-")) {
                position++;
                return atom() == Kind.NUMBER ? Kind.NUMBER : Kind.INVALID;
            }
            return atom();
        }

        private Kind atom() {
            if (atEnd()) {
                return Kind.INVALID;
            }
            PythonToken token = tokens.get(position);
            switch (token.type()) {
                case NUMBER -> {
                    position++;
                    return Kind.NUMBER;
                }
                case STRING -> {
                    while (!atEnd() && tokens.get(position).type() == TokenType.STRING) {
                        if (isFormatted(tokens.get(position).text())) {
                            return Kind.INVALID;
                        }
                        position++;
                    }
                    return Kind.OTHER;
                }
                case NAME -> {
                    if (CONSTANT_NAMES.contains(token.text())) {
                        position++;
                        return Kind.OTHER;
                    }
                    return Kind.INVALID;
                }
                case OP -> {
                    if (token.isOp("...")) {
                        position++;
                        return Kind.OTHER;
                    }
                    if (token.isOp("(")) {
                        return sequence(")");
                    }
                    if (token.isOp("[")) {
                        return sequence("]");
                    }
                    if (token.isOp("{")) {
                        return braces();
                    }
                    return Kind.INVALID;
                }
                default -> {
                    return Kind.INVALID;
                }
            }
        }

        /** Tuple, list or parenthesized literal; a parenthesized number stays a number. */
        private Kind sequence(String close) {
            position++;
            if (accept(close)) {
                return Kind.OTHER;
            }
            Kind first = expression();
            if (first == Kind.INVALID) {
                return Kind.INVALID;
            }
            boolean tuple = false;
            while (accept(",")) {
                tuple = true;
                if (accept(close)) {
                    return Kind.OTHER;
                }
                if (expression() == Kind.INVALID) {
                    return Kind.INVALID;
                }
            }
            if (!accept(close)) {
                return Kind.INVALID;
            }
            return tuple || !close.equals(")") ? Kind.OTHER : first;
        }

        private Kind braces() {
            position++;
            if (accept("}")) {
                return Kind.OTHER;
            }
            if (expression() == Kind.INVALID) {
                return Kind.INVALID;
            }
            boolean dict = accept(":");
            if (dict && expression() == Kind.INVALID) {
                return Kind.INVALID;
            }
            while (accept(",")) {
                if (accept("}")) {
                    return Kind.OTHER;
                }
                if (expression() == Kind.INVALID) {
                    return Kind.INVALID;
                }
                if (dict && (!accept(":") || expression() == Kind.INVALID)) {
                    return Kind.INVALID;
                }
            }
            return accept("}") ? Kind.OTHER : Kind.INVALID;
        }

        private boolean accept(String op) {
            if (peekOp(op)) {
                position++;
                return true;
            }
            return false;
        }

        private boolean peekOp(String op) {
            return !atEnd() && tokens.get(position).isOp(op);
        }

        private boolean atEnd() {
            return position >= tokens.size();
        }

        private static boolean isFormatted(String literal) {
            for (int i = 0; i < literal.length(); i++) {
                char c = literal.charAt(i);
                if (c == '\'' || c == '"') {
                    return false;
                }
                if (c == 'f' || c == 'F') {
                    return true;
                }
            }
            return false;
        }
    }
}
