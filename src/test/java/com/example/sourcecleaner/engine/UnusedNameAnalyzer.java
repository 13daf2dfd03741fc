package com.example.sourcecleaner.engine;

import com.example.sourcecleaner.domain.Diagnostic;
import com.example.sourcecleaner.domain.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stand-in for pyflakes: reports every binding of a name from a fixed set, with the same
 * symbol qualification pyflakes uses.
 */
final class UnusedNameAnalyzer implements DiagnosticSource {
    private static final Pattern PLAIN_IMPORT = Pattern.compile("^\\s*import\\s+(.+)$");
    private static final Pattern FROM_IMPORT = Pattern.compile("^\\s*from\\s+(\\S+)\\s+import\\s+(.+)$");
    private static final Pattern ASSIGNMENT = Pattern.compile("^\\s*(\\w+)\\s*=[^=]");
    private static final Pattern EXCEPT_BINDING = Pattern.compile("^\\s*except\\b.*\\bas\\s+(\\w+):");

    private final Set<String> unused;
    private int calls;

    UnusedNameAnalyzer(String... unused) {
        this.unused = Set.of(unused);
    }

    int calls() {
        return calls;
    }

    @Override
    public List<Diagnostic> diagnose(String source) {
        calls++;
        List<Diagnostic> diagnostics = new ArrayList<>();
        int number = 0;
        for (String line : SourceText.of(source).lines()) {
            number++;
            String code = line.indexOf('#') >= 0 ? line.substring(0, line.indexOf('#')) : line;
            Matcher from = FROM_IMPORT.matcher(code.strip());
            Matcher plain = PLAIN_IMPORT.matcher(code.strip());
            Matcher assignment = ASSIGNMENT.matcher(code);
            Matcher except = EXCEPT_BINDING.matcher(code);
            if (from.find()) {
                String module = from.group(1);
                for (String name : from.group(2).split(",")) {
                    if (unused.contains(name.strip())) {
                        String qualified = module.endsWith(".") ? module + name.strip() : module + "." + name.strip();
                        diagnostics.add(Diagnostic.unusedImport(number, qualified));
                    }
                }
            } else if (plain.find()) {
                for (String module : plain.group(1).split(",")) {
                    if (unused.contains(module.strip())) {
                        diagnostics.add(Diagnostic.unusedImport(number, module.strip()));
                    }
                }
            } else if (assignment.find() && unused.contains(assignment.group(1))) {
                diagnostics.add(Diagnostic.unusedVariable(number, assignment.group(1)));
            } else if (except.find() && unused.contains(except.group(1))) {
                diagnostics.add(Diagnostic.unusedVariable(number, except.group(1)));
            }
        }
        return diagnostics;
    }
}
