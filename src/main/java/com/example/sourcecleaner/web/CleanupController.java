package com.example.sourcecleaner.web;

import com.example.sourcecleaner.application.CleanupUseCase;
import com.example.sourcecleaner.domain.CleanupOptions;
import com.example.sourcecleaner.domain.CleanupReport;
import com.example.sourcecleaner.domain.CleanupRequest;
import com.example.sourcecleaner.domain.FileCleanup;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;

@RestController
@RequestMapping("/api/cleanup")
public class CleanupController {
    private final CleanupUseCase cleanupUseCase;
    private final MultipartArchiveInputAdapter archiveInputAdapter;
    private final int defaultContextSize;

    public CleanupController(
            CleanupUseCase cleanupUseCase,
            MultipartArchiveInputAdapter archiveInputAdapter,
            @Value("${cleaner.diff.context-size:3}") int defaultContextSize) {
        this.cleanupUseCase = cleanupUseCase;
        this.archiveInputAdapter = archiveInputAdapter;
        this.defaultContextSize = defaultContextSize;
    }

    @PostMapping(
            path = "/source",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public FileCleanup cleanSource(@RequestBody CleanSourceRequest request) {
        if (request.getSource() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "source is required");
        }
        CleanupOptions options =
                options(
                        request.getImports() == null ? null : String.join(",", request.getImports()),
                        request.isRemoveAllUnusedImports(),
                        request.isRemoveUnusedVariables());
        int contextSize =
                request.getContextSize() == null ? defaultContextSize : request.getContextSize();
        return cleanupUseCase.cleanSource(
                request.getFileName(), request.getSource(), options, contextSize);
    }

    @PostMapping(
            path = "/archive",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public CleanupReport cleanArchive(
            @RequestParam("files") MultipartFile[] files,
            @RequestParam(name = "imports", required = false) String imports,
            @RequestParam(name = "removeAllUnusedImports", defaultValue = "false")
                    boolean removeAllUnusedImports,
            @RequestParam(name = "removeUnusedVariables", defaultValue = "false")
                    boolean removeUnusedVariables,
            @RequestParam(name = "contextSize", required = false) Integer contextSize)
            throws IOException {
        CleanupOptions options = options(imports, removeAllUnusedImports, removeUnusedVariables);
        CleanupRequest request;
        try {
            request =
                    new CleanupRequest(
                            archiveInputAdapter.adapt(files),
                            options,
                            contextSize == null ? defaultContextSize : contextSize);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        return cleanupUseCase.cleanArchive(request);
    }

    private static CleanupOptions options(
            String imports, boolean removeAllUnusedImports, boolean removeUnusedVariables) {
        try {
            return new CleanupOptions(
                    CleanupOptions.parseImports(imports), removeAllUnusedImports, removeUnusedVariables);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
