package com.example.sourcecleaner.web;

import com.example.sourcecleaner.application.CleanupUseCase;
import com.example.sourcecleaner.domain.CleanupOptions;
import com.example.sourcecleaner.domain.CleanupReport;
import com.example.sourcecleaner.domain.CleanupRequest;
import com.example.sourcecleaner.domain.FileCleanup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CleanupControllerTest {

    @Mock private CleanupUseCase cleanupUseCase;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        CleanupController controller =
                new CleanupController(cleanupUseCase, new MultipartArchiveInputAdapter(), 3);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void cleanSourceReturnsTheFileCleanup() throws Exception {
        when(cleanupUseCase.cleanSource(eq("m.py"), eq("import os\n"), any(CleanupOptions.class), eq(3)))
                .thenReturn(new FileCleanup("m.py", null, true, 2, "pass\n", "--- original/m.py\n"));

        mockMvc.perform(
                        post("/api/cleanup/source")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(
                                        "{\"fileName\":\"m.py\",\"source\":\"import os\\n\","
                                                + "\"imports\":[\"requests\"],\"removeUnusedVariables\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("m.py"))
                .andExpect(jsonPath("$.changed").value(true))
                .andExpect(jsonPath("$.iterations").value(2))
                .andExpect(jsonPath("$.cleanedSource").value("pass\n"));

        ArgumentCaptor<CleanupOptions> options = ArgumentCaptor.forClass(CleanupOptions.class);
        verify(cleanupUseCase).cleanSource(eq("m.py"), eq("import os\n"), options.capture(), eq(3));
        assertThat(options.getValue().additionalImports()).containsExactly("requests");
        assertThat(options.getValue().removeUnusedVariables()).isTrue();
    }

    @Test
    void redundantOptionsAreABadRequest() throws Exception {
        mockMvc.perform(
                        post("/api/cleanup/source")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(
                                        "{\"source\":\"import os\\n\",\"imports\":[\"requests\"],"
                                                + "\"removeAllUnusedImports\":true}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(cleanupUseCase);
    }

    @Test
    void missingSourceIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/cleanup/source").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void cleanArchiveReturnsTheReport() throws Exception {
        CleanupReport report = new CleanupReport("m.zip", List.of(), List.of("m.py"));
        when(cleanupUseCase.cleanArchive(any(CleanupRequest.class))).thenReturn(report);

        mockMvc.perform(
                        multipart("/api/cleanup/archive")
                                .file(
                                        new MockMultipartFile(
                                                "files",
                                                "m.py",
                                                "text/x-python",
                                                "print(1)\n".getBytes(StandardCharsets.UTF_8)))
                                .param("removeAllUnusedImports", "true")
                                .param("contextSize", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.archiveName").value("m.zip"))
                .andExpect(jsonPath("$.unchanged[0]").value("m.py"));

        ArgumentCaptor<CleanupRequest> request = ArgumentCaptor.forClass(CleanupRequest.class);
        verify(cleanupUseCase).cleanArchive(request.capture());
        assertThat(request.getValue().contextSize()).isEqualTo(1);
        assertThat(request.getValue().options().removeAllUnusedImports()).isTrue();
        assertThat(request.getValue().archive().name()).isEqualTo("m.zip");
    }

    @Test
    void unsupportedUploadIsABadRequest() throws Exception {
        mockMvc.perform(
                        multipart("/api/cleanup/archive")
                                .file(
                                        new MockMultipartFile(
                                                "files",
                                                "notes.txt",
                                                "text/plain",
                                                "hello".getBytes(StandardCharsets.UTF_8))))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(cleanupUseCase);
    }
}
