package com.example.sourcecleaner.engine;

import org.springframework.stereotype.Component;

/**
 * Rewrites a line that binds a local name the analyzer reported as never used.
 */
@Component
public class VariableRewriter {
    private final LineClassifier classifier;
    private final LiteralExpressions literals;

    public VariableRewriter(LineClassifier classifier, LiteralExpressions literals) {
        this.classifier = classifier;
        this.literals = literals;
    }

    public String rewrite(String line, String previousLine) {
        return switch (classifier.classify(line, previousLine)) {
            case EXCEPT_BINDING -> stripExceptBinding(line);
            case ASSIGNMENT -> dropBinding(line);
            default -> line;
        };
    }

    /** {@code except E as e:} becomes {@code except E:}. */
    private String stripExceptBinding(String line) {
        String body = LineClassifier.withoutTerminator(line);
        String terminator = line.substring(body.length());
        return body.replaceFirst("(?U) as \\w+:$", ":") + terminator;
    }

    /**
     * Keeps the right-hand side as an expression statement unless evaluating it is known to
     * be free of side effects, in which case the line becomes a placeholder.
     */
    private String dropBinding(String line) {
        String value = line.substring(line.indexOf('=') + 1).stripLeading();
        if (literals.isLiteralOrName(value)) {
            return LineClassifier.placeholderFor(line);
        }
        return LineClassifier.indentation(line) + value;
    }
}
