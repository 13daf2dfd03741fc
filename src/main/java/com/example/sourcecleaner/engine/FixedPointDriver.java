package com.example.sourcecleaner.engine;

import com.example.sourcecleaner.domain.CleanupResult;
import com.example.sourcecleaner.domain.Diagnostic;
import com.example.sourcecleaner.domain.DiagnosticKind;
import com.example.sourcecleaner.domain.RewritePolicy;
import com.example.sourcecleaner.domain.SourceText;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Re-runs diagnose, rewrite and compact on a source buffer until a pass leaves it unchanged.
 *
 * <p>Every pass only deletes names or blanks statements the analyzer already flagged, and
 * splitting a multi-module import only postpones names that were already there, so the
 * number of passes is bounded by the number of initial findings plus one.
 */
@Component
public class FixedPointDriver {
    private static final Logger log = LogManager.getLogger(FixedPointDriver.class);

    // pyflakes does not handle "nonlocal" correctly.
    private static final Pattern NONLOCAL = Pattern.compile("\\bnonlocal\\b");

    private final ImportRewriter importRewriter;
    private final VariableRewriter variableRewriter;
    private final PassCompactor passCompactor;

    public FixedPointDriver(
            ImportRewriter importRewriter,
            VariableRewriter variableRewriter,
            PassCompactor passCompactor) {
        this.importRewriter = importRewriter;
        this.variableRewriter = variableRewriter;
        this.passCompactor = passCompactor;
    }

    public CleanupResult clean(String source, DiagnosticSource diagnosticSource, RewritePolicy policy) {
        if (source.isEmpty()) {
            return new CleanupResult(source, source, 0);
        }
        RewritePolicy effective = policy;
        if (policy.removeUnusedVariables() && NONLOCAL.matcher(source).find()) {
            log.debug("Source uses nonlocal; leaving unused variables in place");
            effective = policy.withoutVariableRemoval();
        }

        String current = source;
        int iterations = 0;
        while (true) {
            iterations++;
            String filtered = passCompactor.compact(rewritePass(current, diagnosticSource, effective));
            if (filtered.equals(current)) {
                break;
            }
            log.debug("Pass {} changed the source, diagnosing again", iterations);
            current = filtered;
        }
        log.debug("Reached a fixed point after {} pass(es)", iterations);
        return new CleanupResult(source, current, iterations);
    }

    /** One diagnose-and-rewrite pass over {@code source}, without compaction. */
    public String rewritePass(String source, DiagnosticSource diagnosticSource, RewritePolicy policy) {
        List<Diagnostic> diagnostics = diagnose(source, diagnosticSource);

        Map<Integer, List<String>> unusedImports = new HashMap<>();
        Set<Integer> unusedVariableLines = new HashSet<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.kind() == DiagnosticKind.UNUSED_IMPORT) {
                List<String> names =
                        unusedImports.computeIfAbsent(diagnostic.line(), line -> new ArrayList<>());
                if (diagnostic.symbol() != null) {
                    names.add(diagnostic.symbol());
                }
            } else if (policy.removeUnusedVariables()) {
                unusedVariableLines.add(diagnostic.line());
            }
        }
        if (unusedImports.isEmpty() && unusedVariableLines.isEmpty()) {
            return source;
        }

        StringBuilder rewritten = new StringBuilder(source.length());
        String previousLine = "";
        int number = 0;
        for (String line : SourceText.of(source).lines()) {
            number++;
            if (line.indexOf('#') >= 0) {
                rewritten.append(line);
            } else if (unusedImports.containsKey(number)) {
                rewritten.append(
                        importRewriter.rewrite(line, unusedImports.get(number), policy, previousLine));
            } else if (unusedVariableLines.contains(number)) {
                rewritten.append(variableRewriter.rewrite(line, previousLine));
            } else {
                rewritten.append(line);
            }
            previousLine = line;
        }
        return rewritten.toString();
    }

    private List<Diagnostic> diagnose(String source, DiagnosticSource diagnosticSource) {
        try {
            return diagnosticSource.diagnose(source);
        } catch (DiagnosticSourceException e) {
            log.warn("Analyzer failed, treating source as clean for this pass: {}", e.getMessage());
            return List.of();
        }
    }
}
