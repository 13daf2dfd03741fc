package com.example.sourcecleaner.engine;

import com.example.sourcecleaner.domain.LineRole;
import com.example.sourcecleaner.domain.RewritePolicy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites an import line that the analyzer reported as (partly) unused.
 */
@Component
public class ImportRewriter {
    private static final Pattern IMPORT_KEYWORD = Pattern.compile("\\bimport\\b");
    private static final Pattern FROM_MODULE = Pattern.compile("\\bfrom\\s+(\\S+)");
    private static final Pattern FROM_IMPORT = Pattern.compile("^\\s*from\\s");

    private final LineClassifier classifier;

    public ImportRewriter(LineClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @param unusedNames names the analyzer reported for this line, qualified the way pyflakes
     *     reports them ({@code os.path}, {@code pkg.name}, {@code pkg.name as alias})
     */
    public String rewrite(
            String line, Collection<String> unusedNames, RewritePolicy policy, String previousLine) {
        LineRole role = classifier.classify(line, previousLine);
        if (!role.isImport()) {
            return line;
        }
        if (role == LineRole.PLAIN_IMPORT && line.indexOf(',') >= 0) {
            return breakUpImport(line);
        }
        String packageName = extractPackageName(line);
        if (!policy.removeAllUnusedImports() && !policy.isEligible(packageName)) {
            return line;
        }
        if (line.indexOf(',') >= 0) {
            return filterFromImport(line, unusedNames);
        }
        // A lone import may be the whole body of a block.
        return LineClassifier.placeholderFor(line);
    }

    /** {@code import b, a} becomes one {@code import} line per module, sorted by name. */
    public String breakUpImport(String line) {
        requireSingleLineStatement(line);
        if (line.indexOf('#') >= 0) {
            throw new IllegalStateException("Cannot split an import carrying a comment: " + line);
        }
        if (FROM_IMPORT.matcher(line).lookingAt()) {
            throw new IllegalStateException("Cannot split a from-import: " + line);
        }
        String newline = LineClassifier.lineEnding(line);
        if (newline.isEmpty()) {
            return line;
        }
        Matcher keyword = IMPORT_KEYWORD.matcher(line);
        if (!keyword.find()) {
            throw new IllegalStateException("Not an import statement: " + line);
        }
        String indentation = line.substring(0, keyword.start());
        List<String> modules = new ArrayList<>();
        for (String part : line.substring(keyword.end()).split(",")) {
            String module = part.strip();
            if (!module.isEmpty()) {
                modules.add(module);
            }
        }
        modules.sort(null);
        StringBuilder split = new StringBuilder();
        for (String module : modules) {
            split.append(indentation).append("import ").append(module).append(newline);
        }
        return split.toString();
    }

    /**
     * Drops the unused names from {@code from module import a, b}. Returns a placeholder
     * statement when none is left.
     */
    public String filterFromImport(String line, Collection<String> unusedNames) {
        Matcher keyword = IMPORT_KEYWORD.matcher(line);
        if (!keyword.find()) {
            throw new IllegalStateException("Not an import statement: " + line);
        }
        String head = line.substring(0, keyword.start());
        Matcher base = FROM_MODULE.matcher(head);
        if (!base.find()) {
            throw new IllegalStateException("Not a from-import: " + line);
        }
        String module = base.group(1);

        List<String> kept = new ArrayList<>();
        for (String part : line.substring(keyword.end()).strip().split(",")) {
            String name = part.strip();
            if (!name.isEmpty() && !unusedNames.contains(qualify(module, name))) {
                kept.add(name);
            }
        }
        if (kept.isEmpty()) {
            return LineClassifier.placeholderFor(line);
        }
        kept.sort(null);
        return head + "import " + String.join(", ", kept) + LineClassifier.lineEnding(line);
    }

    /** Top-level package of the imported module: empty for relative imports, null for non-imports. */
    public String extractPackageName(String line) {
        requireSingleLineStatement(line);
        String[] words = line.strip().split("\\s+");
        if (words.length < 2 || !(words[0].equals("import") || words[0].equals("from"))) {
            return null;
        }
        String word = words[1];
        int dot = word.indexOf('.');
        return dot < 0 ? word : word.substring(0, dot);
    }

    private static String qualify(String module, String name) {
        return module.endsWith(".") ? module + name : module + "." + name;
    }

    private static void requireSingleLineStatement(String line) {
        for (char symbol : new char[] {'\\', '(', ')', ';'}) {
            if (line.indexOf(symbol) >= 0) {
                throw new IllegalStateException(
                        "Unexpected '" + symbol + "' in single-line import: " + line);
            }
        }
    }
}
