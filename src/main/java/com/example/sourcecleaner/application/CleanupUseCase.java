package com.example.sourcecleaner.application;

import com.example.sourcecleaner.domain.ArchiveInput;
import com.example.sourcecleaner.domain.CleanupOptions;
import com.example.sourcecleaner.domain.CleanupReport;
import com.example.sourcecleaner.domain.CleanupRequest;
import com.example.sourcecleaner.domain.CleanupResult;
import com.example.sourcecleaner.domain.DecodedSource;
import com.example.sourcecleaner.domain.FileCleanup;
import com.example.sourcecleaner.domain.RewritePolicy;
import com.example.sourcecleaner.domain.SafeSymbolRegistry;
import com.example.sourcecleaner.domain.StepTiming;
import com.example.sourcecleaner.engine.DiagnosticSource;
import com.example.sourcecleaner.engine.FixedPointDriver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

@Service
public class CleanupUseCase {
    private static final Logger log = LogManager.getLogger(CleanupUseCase.class);
    private static final String PYTHON_SUFFIX = ".py";

    private final FixedPointDriver driver;
    private final DiagnosticSource diagnosticSource;
    private final SafeSymbolRegistry safeSymbolRegistry;
    private final SourceCodec sourceCodec;
    private final DiffRenderer diffRenderer;

    public CleanupUseCase(
            FixedPointDriver driver,
            DiagnosticSource diagnosticSource,
            SafeSymbolRegistry safeSymbolRegistry,
            SourceCodec sourceCodec,
            DiffRenderer diffRenderer) {
        this.driver = driver;
        this.diagnosticSource = diagnosticSource;
        this.safeSymbolRegistry = safeSymbolRegistry;
        this.sourceCodec = sourceCodec;
        this.diffRenderer = diffRenderer;
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    private double recordStep(List<StepTiming> timings, String label, int fileCount, long startNanos) {
        double seconds = nanosToSeconds(System.nanoTime() - startNanos);
        timings.add(new StepTiming(label, fileCount, seconds));
        return seconds;
    }

    public RewritePolicy policyFor(CleanupOptions options) {
        return new RewritePolicy(
                safeSymbolRegistry.withAdditional(options.additionalImports()),
                options.removeAllUnusedImports(),
                options.removeUnusedVariables());
    }

    public FileCleanup cleanSource(
            String fileName, String source, CleanupOptions options, int contextSize) {
        return clean(fileName, source, null, policyFor(options), contextSize);
    }

    public FileCleanup cleanSource(
            String fileName, DecodedSource source, CleanupOptions options, int contextSize) {
        return clean(fileName, source.text(), source.charset().name(), policyFor(options), contextSize);
    }

    public CleanupReport cleanArchive(CleanupRequest request) throws IOException {
        List<StepTiming> timings = new ArrayList<>();
        long overallStart = System.nanoTime();

        long readStart = System.nanoTime();
        Map<String, DecodedSource> sources = readSources(request.archive());
        double readSeconds = recordStep(timings, "Read sources", sources.size(), readStart);
        log.info("Read {} Python sources from {} in {}s", sources.size(), request.archive().name(), readSeconds);

        RewritePolicy policy = policyFor(request.options());
        long cleanStart = System.nanoTime();
        List<FileCleanup> changed = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        for (Map.Entry<String, DecodedSource> e : sources.entrySet()) {
            DecodedSource source = e.getValue();
            FileCleanup cleanup =
                    clean(e.getKey(), source.text(), source.charset().name(), policy, request.contextSize());
            if (cleanup.isChanged()) {
                changed.add(cleanup);
            } else {
                unchanged.add(e.getKey());
            }
        }
        double cleanSeconds = recordStep(timings, "Clean sources", sources.size(), cleanStart);
        log.info("Cleaned {} sources in {}s, {} changed", sources.size(), cleanSeconds, changed.size());

        CleanupReport report = new CleanupReport(request.archive().name(), changed, unchanged);
        report.setSteps(List.copyOf(timings));
        report.setTotalDurationSeconds(nanosToSeconds(System.nanoTime() - overallStart));
        return report;
    }

    private FileCleanup clean(
            String fileName, String source, String encoding, RewritePolicy policy, int contextSize) {
        CleanupResult result = driver.clean(source, diagnosticSource, policy);
        String diff =
                result.isChanged()
                        ? diffRenderer.render(fileName, source, result.cleaned(), Math.max(0, contextSize))
                        : "";
        return new FileCleanup(
                fileName, encoding, result.isChanged(), result.iterations(), result.cleaned(), diff);
    }

    private Map<String, DecodedSource> readSources(ArchiveInput archive) throws IOException {
        Map<String, DecodedSource> result = new TreeMap<>();
        try (InputStream inputStream = archive.openStream();
                ZipInputStream zis = new ZipInputStream(inputStream)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (!entry.isDirectory() && isPythonSource(entry.getName())) {
                    result.put(entry.getName(), sourceCodec.decode(zis.readAllBytes()));
                }
            }
        }
        return result;
    }

    /** {@code .py} files outside hidden directories, and not hidden themselves. */
    static boolean isPythonSource(String entryName) {
        String normalized = entryName.replace('\\', '/');
        if (!normalized.endsWith(PYTHON_SUFFIX)) {
            return false;
        }
        for (String segment : normalized.split("/")) {
            if (segment.startsWith(".")) {
                return false;
            }
        }
        return true;
    }
}
