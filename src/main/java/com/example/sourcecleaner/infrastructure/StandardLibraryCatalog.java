package com.example.sourcecleaner.infrastructure;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;

/**
 * Lists the names of standard-library modules, either from the bundled module list or by
 * scanning an interpreter's library directory.
 */
@Component
public class StandardLibraryCatalog {
    private static final Logger log = LogManager.getLogger(StandardLibraryCatalog.class);

    static final String BUNDLED_RESOURCE = "python-stdlib-modules.txt";
    private static final Set<String> MODULE_EXTENSIONS = Set.of("so", "py", "pyc");

    public Set<String> bundled() throws IOException {
        Set<String> modules = new TreeSet<>();
        try (InputStream stream = getClass().getClassLoader().getResourceAsStream(BUNDLED_RESOURCE)) {
            if (stream == null) {
                throw new IOException("Missing classpath resource " + BUNDLED_RESOURCE);
            }
            BufferedReader reader =
                    new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                String name = line.strip();
                if (!name.isEmpty() && !name.startsWith("#")) {
                    modules.add(name);
                }
            }
        }
        return modules;
    }

    /** Scans {@code libraryDirectory} and its {@code lib-dynload} subdirectory. */
    public Set<String> scan(Path libraryDirectory) throws IOException {
        if (!Files.isDirectory(libraryDirectory)) {
            throw new IOException("Not a directory: " + libraryDirectory);
        }
        Set<String> modules = new TreeSet<>();
        collect(libraryDirectory, modules);
        Path dynload = libraryDirectory.resolve("lib-dynload");
        if (Files.isDirectory(dynload)) {
            collect(dynload, modules);
        }
        log.debug("Found {} standard-library modules under {}", modules.size(), libraryDirectory);
        return modules;
    }

    private static void collect(Path directory, Set<String> modules) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                String name = moduleName(entry.getFileName().toString());
                if (name != null) {
                    modules.add(name);
                }
            }
        }
    }

    static String moduleName(String fileName) {
        if (fileName.startsWith("_") || fileName.contains("-")) {
            return null;
        }
        int dot = fileName.indexOf('.');
        if (dot < 0) {
            // packages are directories
            return fileName.isEmpty() ? null : fileName;
        }
        String extension = fileName.substring(fileName.lastIndexOf('.') + 1);
        if (!MODULE_EXTENSIONS.contains(extension)) {
            return null;
        }
        return fileName.substring(0, dot);
    }
}
