package com.example.sourcecleaner.cli;

import com.example.sourcecleaner.application.CleanupUseCase;
import com.example.sourcecleaner.domain.CleanupOptions;
import com.example.sourcecleaner.domain.Diagnostic;
import com.example.sourcecleaner.domain.SafeSymbolRegistry;
import com.example.sourcecleaner.engine.DiagnosticSource;
import com.example.sourcecleaner.engine.FixedPointDriver;
import com.example.sourcecleaner.engine.ImportRewriter;
import com.example.sourcecleaner.engine.LineClassifier;
import com.example.sourcecleaner.engine.LiteralExpressions;
import com.example.sourcecleaner.engine.PassCompactor;
import com.example.sourcecleaner.engine.PythonTokenizer;
import com.example.sourcecleaner.engine.VariableRewriter;
import com.example.sourcecleaner.infrastructure.PythonSourceCodec;
import com.example.sourcecleaner.infrastructure.SourceFileWalker;
import com.example.sourcecleaner.infrastructure.UnifiedDiffRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CommandLineCleanerTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private CommandLineCleaner cleaner;

    @BeforeEach
    void setUp() {
        PythonTokenizer tokenizer = new PythonTokenizer();
        LineClassifier classifier = new LineClassifier(tokenizer);
        FixedPointDriver driver =
                new FixedPointDriver(
                        new ImportRewriter(classifier),
                        new VariableRewriter(classifier, new LiteralExpressions(tokenizer)),
                        new PassCompactor(tokenizer));
        DiagnosticSource firstLineImport =
                source ->
                        source.startsWith("import os\n")
                                ? List.of(Diagnostic.unusedImport(1, "os"))
                                : List.of();
        PythonSourceCodec codec = new PythonSourceCodec();
        CleanupUseCase useCase =
                new CleanupUseCase(
                        driver,
                        firstLineImport,
                        SafeSymbolRegistry.fromStandardLibrary(List.of("os")),
                        codec,
                        new UnifiedDiffRenderer());
        cleaner = new CommandLineCleaner(useCase, codec, new SourceFileWalker(), "1.0", 3);
    }

    private int run(List<String> names, boolean inPlace, boolean recursive) {
        return cleaner.run(
                names,
                CleanupOptions.defaults(),
                inPlace,
                recursive,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void printsDiffWithoutTouchingTheFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("m.py");
        Files.writeString(file, "import os\nprint(1)\n");

        assertEquals(0, run(List.of(file.toString()), false, false));

        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("--- original/" + file)
                .contains("+++ fixed/" + file)
                .contains("-import os\n");
        assertThat(Files.readString(file)).isEqualTo("import os\nprint(1)\n");
    }

    @Test
    void rewritesInPlaceKeepingTheEncoding(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("m.py");
        byte[] latin1 = "import os\nname = 'é'\n".getBytes(StandardCharsets.ISO_8859_1);
        Files.write(file, latin1);

        assertEquals(0, run(List.of(file.toString()), true, false));

        assertThat(Files.readAllBytes(file))
                .isEqualTo("name = 'é'\n".getBytes(StandardCharsets.ISO_8859_1));
        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void unreadableFileIsReportedAndOthersContinue(@TempDir Path dir) throws IOException {
        Path missing = dir.resolve("missing.py");
        Path file = dir.resolve("m.py");
        Files.writeString(file, "import os\nprint(1)\n");

        assertEquals(0, run(List.of(missing.toString(), file.toString()), true, false));

        assertThat(err.toString(StandardCharsets.UTF_8)).contains("missing.py");
        assertThat(Files.readString(file)).isEqualTo("print(1)\n");
    }

    @Test
    void recursiveRunCleansPythonFilesInDirectories(@TempDir Path dir) throws IOException {
        Path pkg = Files.createDirectories(dir.resolve("pkg"));
        Files.writeString(pkg.resolve("a.py"), "import os\nprint(1)\n");
        Files.writeString(pkg.resolve("a.txt"), "import os\nprint(1)\n");

        run(List.of(dir.toString()), true, true);

        assertThat(Files.readString(pkg.resolve("a.py"))).isEqualTo("print(1)\n");
        assertThat(Files.readString(pkg.resolve("a.txt"))).isEqualTo("import os\nprint(1)\n");
    }

    @Test
    void shortFlagsSelectInPlaceAndRecursive(@TempDir Path dir) throws IOException {
        Path pkg = Files.createDirectories(dir.resolve("pkg"));
        Files.writeString(pkg.resolve("a.py"), "import os\nprint(1)\n");

        cleaner.run(new DefaultApplicationArguments("-i", "-r", dir.toString()));

        assertEquals(0, cleaner.getExitCode());
        assertThat(Files.readString(pkg.resolve("a.py"))).isEqualTo("print(1)\n");
    }

    @Test
    void redundantOptionsExitWithOne() {
        cleaner.run(
                new DefaultApplicationArguments(
                        "--imports=requests", "--remove-all-unused-imports", "m.py"));

        assertEquals(1, cleaner.getExitCode());
    }

    @Test
    void noFileArgumentsDoNothing() {
        cleaner.run(new DefaultApplicationArguments("--server.port=8080"));

        assertEquals(0, cleaner.getExitCode());
    }
}
