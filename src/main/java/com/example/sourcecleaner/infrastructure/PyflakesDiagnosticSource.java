package com.example.sourcecleaner.infrastructure;

import com.example.sourcecleaner.domain.Diagnostic;
import com.example.sourcecleaner.engine.DiagnosticSource;
import com.example.sourcecleaner.engine.DiagnosticSourceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs pyflakes as an external process, feeding the source on stdin. Exit status 1 with a
 * report on stdout means warnings were found; any other non-zero exit is a failure.
 */
@Component
public class PyflakesDiagnosticSource implements DiagnosticSource {
    private static final Logger log = LogManager.getLogger(PyflakesDiagnosticSource.class);

    private final List<String> command;
    private final long timeoutSeconds;

    public PyflakesDiagnosticSource(
            @Value("${cleaner.pyflakes.command:python3 -m pyflakes}") String command,
            @Value("${cleaner.pyflakes.timeout-seconds:30}") long timeoutSeconds) {
        this.command = Arrays.asList(command.strip().split("\\s+"));
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    @Override
    public List<Diagnostic> diagnose(String source) throws DiagnosticSourceException {
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new DiagnosticSourceException("Unable to start " + String.join(" ", command), e);
        }
        try {
            CompletableFuture<String> report =
                    CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
            CompletableFuture<String> errors =
                    CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(source.getBytes(StandardCharsets.UTF_8));
            }
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                throw new DiagnosticSourceException(
                        "pyflakes did not finish within " + timeoutSeconds + "s");
            }
            int exitCode = process.exitValue();
            String output = report.join();
            if (exitCode > 1 || (exitCode != 0 && output.isBlank())) {
                throw new DiagnosticSourceException(
                        "pyflakes exited with status " + exitCode + ": " + errors.join().strip());
            }
            List<Diagnostic> diagnostics = PyflakesReportParser.parse(output);
            log.debug("pyflakes reported {} unused names", diagnostics.size());
            return diagnostics;
        } catch (IOException e) {
            throw new DiagnosticSourceException("Unable to send source to pyflakes", e);
        } catch (CompletionException e) {
            throw new DiagnosticSourceException("Unable to read pyflakes report", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiagnosticSourceException("Interrupted while waiting for pyflakes", e);
        } finally {
            process.destroyForcibly();
        }
    }

    private static String readFully(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
