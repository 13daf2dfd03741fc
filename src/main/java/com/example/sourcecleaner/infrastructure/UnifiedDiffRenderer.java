package com.example.sourcecleaner.infrastructure;

import com.example.sourcecleaner.application.DiffRenderer;
import com.example.sourcecleaner.domain.SourceText;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class UnifiedDiffRenderer implements DiffRenderer {
    static final String NO_NEWLINE_MARKER = "\\ No newline at end of file";

    @Override
    public String render(String fileName, String original, String revised, int contextSize) {
        List<String> originalLines = diffLines(original);
        List<String> revisedLines = diffLines(revised);
        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unified =
                UnifiedDiffUtils.generateUnifiedDiff(
                        "original/" + fileName,
                        "fixed/" + fileName,
                        originalLines,
                        patch,
                        Math.max(0, contextSize));
        return String.join("\n", unified) + "\n";
    }

    /**
     * Lines without their {@code \n}. An unterminated last line carries the "no newline" marker
     * so that it differs from the same text with a terminator and renders the marker line.
     */
    private static List<String> diffLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : SourceText.of(text).lines()) {
            if (line.endsWith("\n")) {
                lines.add(line.substring(0, line.length() - 1));
            } else {
                lines.add(line + "\n" + NO_NEWLINE_MARKER);
            }
        }
        return lines;
    }
}
