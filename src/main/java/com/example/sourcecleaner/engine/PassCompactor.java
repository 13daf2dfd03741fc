package com.example.sourcecleaner.engine;

import com.example.sourcecleaner.domain.SourceText;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.TreeSet;

/**
 * Removes placeholder statements that no longer keep a block from being empty.
 */
@Component
public class PassCompactor {
    private static final Logger log = LogManager.getLogger(PassCompactor.class);

    private final PythonTokenizer tokenizer;

    public PassCompactor(PythonTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /** Returns {@code source} without its redundant placeholders, or unchanged if it does not tokenize. */
    public String compact(String source) {
        Set<Integer> redundant;
        try {
            redundant = uselessPlaceholderRows(source);
        } catch (TokenizeException e) {
            log.debug("Skipping placeholder compaction: {}", e.getMessage());
            return source;
        }
        if (redundant.isEmpty()) {
            return source;
        }
        SourceText text = SourceText.of(source);
        StringBuilder compacted = new StringBuilder(source.length());
        for (int row = 1; row <= text.lineCount(); row++) {
            if (!redundant.contains(row)) {
                compacted.append(text.line(row));
            }
        }
        return compacted.toString();
    }

    /**
     * 1-based rows holding a placeholder that can go. A placeholder is redundant when it is
     * not the first statement of its block (trailing), or when the next line starts another
     * statement at the same indentation (leading). A placeholder opening the module goes as
     * soon as any other statement follows it.
     */
    public Set<Integer> uselessPlaceholderRows(String source) throws TokenizeException {
        Set<Integer> rows = new TreeSet<>();
        TokenType previousType = null;
        String previousLine = "";
        boolean statementSeen = false;
        int lastPlaceholderRow = -1;
        String lastPlaceholderIndentation = null;
        int moduleFirstRow = -1;

        for (PythonToken token : tokenizer.tokenize(source)) {
            boolean placeholder =
                    token.type() == TokenType.NAME
                            && token.line().strip().equals(LineClassifier.PLACEHOLDER);
            String indentation = LineClassifier.indentation(token.line());

            if (token.row() - 1 == lastPlaceholderRow
                    && indentation.equals(lastPlaceholderIndentation)
                    && token.type().isAtom()
                    && !placeholder) {
                rows.add(token.row() - 1);
            }

            if (placeholder) {
                lastPlaceholderRow = token.row();
                lastPlaceholderIndentation = indentation;
                if (statementSeen
                        && previousType != TokenType.INDENT
                        && !previousLine.stripTrailing().endsWith("\\")) {
                    rows.add(token.row());
                }
                if (!statementSeen) {
                    moduleFirstRow = token.row();
                }
            } else if (moduleFirstRow > 0 && token.type().isReal()) {
                rows.add(moduleFirstRow);
                moduleFirstRow = -1;
            }

            if (token.type().isReal()) {
                statementSeen = true;
            }
            previousType = token.type();
            previousLine = token.line();
        }
        return rows;
    }
}
