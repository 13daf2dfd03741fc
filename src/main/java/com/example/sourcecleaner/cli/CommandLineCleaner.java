package com.example.sourcecleaner.cli;

import com.example.sourcecleaner.application.CleanupUseCase;
import com.example.sourcecleaner.application.SourceCodec;
import com.example.sourcecleaner.domain.CleanupOptions;
import com.example.sourcecleaner.domain.DecodedSource;
import com.example.sourcecleaner.domain.FileCleanup;
import com.example.sourcecleaner.infrastructure.SourceFileWalker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Cleans the files named on the command line, either printing a diff per changed file or
 * rewriting them in place.
 */
@Component
public class CommandLineCleaner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LogManager.getLogger(CommandLineCleaner.class);
    private static final String IN_PLACE_FLAG = "-i";
    private static final String RECURSIVE_FLAG = "-r";

    private final CleanupUseCase cleanupUseCase;
    private final SourceCodec sourceCodec;
    private final SourceFileWalker sourceFileWalker;
    private final String version;
    private final int contextSize;
    private int exitCode;

    public CommandLineCleaner(
            CleanupUseCase cleanupUseCase,
            SourceCodec sourceCodec,
            SourceFileWalker sourceFileWalker,
            @Value("${cleaner.version:unknown}") String version,
            @Value("${cleaner.diff.context-size:3}") int contextSize) {
        this.cleanupUseCase = cleanupUseCase;
        this.sourceCodec = sourceCodec;
        this.sourceFileWalker = sourceFileWalker;
        this.version = version;
        this.contextSize = contextSize;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption("version")) {
            System.out.println("source-cleaner " + version);
            return;
        }
        // Spring only parses "--" options, so the short flags arrive as plain arguments.
        List<String> arguments = args.getNonOptionArgs();
        List<String> files =
                arguments.stream()
                        .filter(arg -> !arg.equals(IN_PLACE_FLAG) && !arg.equals(RECURSIVE_FLAG))
                        .collect(Collectors.toList());
        if (files.isEmpty()) {
            return;
        }
        CleanupOptions options;
        try {
            options =
                    new CleanupOptions(
                            CleanupOptions.parseImports(lastValue(args, "imports")),
                            args.containsOption("remove-all-unused-imports"),
                            args.containsOption("remove-unused-variables"));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            exitCode = 1;
            return;
        }
        exitCode =
                run(
                        files,
                        options,
                        args.containsOption("in-place") || arguments.contains(IN_PLACE_FLAG),
                        args.containsOption("recursive") || arguments.contains(RECURSIVE_FLAG),
                        System.out,
                        System.err);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public int run(
            List<String> names,
            CleanupOptions options,
            boolean inPlace,
            boolean recursive,
            PrintStream out,
            PrintStream err) {
        List<Path> files;
        try {
            files = sourceFileWalker.discover(names, recursive);
        } catch (IOException e) {
            err.println(e.getMessage());
            return 1;
        }
        int changed = 0;
        for (Path file : files) {
            try {
                if (fixFile(file, options, inPlace, out)) {
                    changed++;
                }
            } catch (IOException e) {
                err.println(file + ": " + e);
            }
        }
        log.debug("{} of {} files changed", changed, files.size());
        return 0;
    }

    private boolean fixFile(Path file, CleanupOptions options, boolean inPlace, PrintStream out)
            throws IOException {
        DecodedSource source = sourceCodec.decode(Files.readAllBytes(file));
        FileCleanup cleanup = cleanupUseCase.cleanSource(file.toString(), source, options, contextSize);
        if (!cleanup.isChanged()) {
            return false;
        }
        if (inPlace) {
            Files.write(file, sourceCodec.encode(source, cleanup.getCleanedSource()));
        } else {
            out.print(cleanup.getDiff());
        }
        return true;
    }

    private static String lastValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
