package com.routedoc.service.impl;

import com.routedoc.config.OpenApiProperties;
import com.routedoc.exception.RouteDocException;
import com.routedoc.service.api.OpenApiDocumentService;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentExporterImplTest {

    @Mock
    private OpenApiDocumentService documentService;

    @TempDir
    Path tempDir;

    private DocumentExporterImpl exporter;

    @BeforeEach
    void setUp() {
        exporter = new DocumentExporterImpl(documentService, new ViewerPageRendererImpl(), new OpenApiProperties());
    }

    @Test
    void export_shouldWriteDocumentAndViewerPage() throws Exception {
        when(documentService.getDocumentJson()).thenReturn("{\"openapi\" : \"3.0.2\"}");
        Path target = tempDir.resolve("site");

        Path written = exporter.export(target, "redoc");

        assertThat(written).isEqualTo(target.resolve("openapi.json"));
        assertThat(Files.readString(written)).isEqualTo("{\"openapi\" : \"3.0.2\"}");
        assertThat(Files.readString(target.resolve(DocumentExporterImpl.INDEX))).contains("spec-url=\"openapi.json\"");
    }

    @Test
    void export_shouldUseConfiguredFilename() throws Exception {
        OpenApiProperties properties = new OpenApiProperties();
        properties.setFilename("api.json");
        exporter = new DocumentExporterImpl(documentService, new ViewerPageRendererImpl(), properties);
        when(documentService.getDocumentJson()).thenReturn("{}");

        Path written = exporter.export(tempDir, "swagger");

        assertThat(written.getFileName().toString()).isEqualTo("api.json");
        assertThat(Files.readString(tempDir.resolve("index.html"))).contains("data-spec-url=\"api.json\"");
    }

    @Test
    void export_shouldPropagateMissingRouteTable() {
        when(documentService.getDocumentJson()).thenThrow(new RouteDocException("No route table loaded. Use 'load' first."));

        assertThatThrownBy(() -> exporter.export(tempDir, "swagger"))
                .isInstanceOf(RouteDocException.class)
                .hasMessageContaining("No route table loaded");
        assertThat(tempDir.resolve("index.html")).doesNotExist();
    }
}
