package com.example.sourcecleaner.infrastructure;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands command-line arguments into the Python files to clean.
 */
@Component
public class SourceFileWalker {

    /**
     * Plain files are returned as given, whatever their extension. Directories are descended
     * only when {@code recursive} is set, skipping hidden entries and keeping {@code *.py} files.
     */
    public List<Path> discover(Collection<String> names, boolean recursive) throws IOException {
        Set<Path> files = new LinkedHashSet<>();
        for (String name : names) {
            Path path = Path.of(name);
            if (recursive && Files.isDirectory(path)) {
                walk(path, files);
            } else {
                files.add(path);
            }
        }
        return new ArrayList<>(files);
    }

    private static void walk(Path root, Set<Path> files) throws IOException {
        List<Path> found = new ArrayList<>();
        Files.walkFileTree(
                root,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        if (!dir.equals(root) && isHidden(dir)) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile()
                                && !isHidden(file)
                                && file.getFileName().toString().endsWith(".py")) {
                            found.add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });
        found.sort(null);
        files.addAll(found);
    }

    private static boolean isHidden(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().startsWith(".");
    }
}
