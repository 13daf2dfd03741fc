package com.example.sourcecleaner.infrastructure;

import com.example.sourcecleaner.domain.Diagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the unused-import and unused-variable findings out of pyflakes' text report. Every
 * other kind of message is skipped.
 */
public final class PyflakesReportParser {
    // file:line[:column]: message
    private static final Pattern REPORT_LINE = Pattern.compile("^.*?:(\\d+):(?:\\d+:)?\\s(.*)$");
    private static final Pattern UNUSED_IMPORT = Pattern.compile("^'(.+?)' imported but unused");
    private static final Pattern UNUSED_VARIABLE =
            Pattern.compile("^local variable '(.+?)' is assigned to but never used");

    private PyflakesReportParser() {
    }

    public static List<Diagnostic> parse(String report) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String reportLine : report.split("\\R")) {
            Matcher line = REPORT_LINE.matcher(reportLine);
            if (!line.matches()) {
                continue;
            }
            int lineNumber;
            try {
                lineNumber = Integer.parseInt(line.group(1));
            } catch (NumberFormatException e) {
                continue;
            }
            if (lineNumber < 1) {
                continue;
            }
            String message = line.group(2);
            Matcher unusedImport = UNUSED_IMPORT.matcher(message);
            if (unusedImport.find()) {
                diagnostics.add(Diagnostic.unusedImport(lineNumber, unusedImport.group(1)));
                continue;
            }
            Matcher unusedVariable = UNUSED_VARIABLE.matcher(message);
            if (unusedVariable.find()) {
                diagnostics.add(Diagnostic.unusedVariable(lineNumber, unusedVariable.group(1)));
            }
        }
        return diagnostics;
    }
}
