package com.routedoc.service.impl;

import com.routedoc.config.OpenApiProperties;
import com.routedoc.exception.RouteDocException;
import com.routedoc.service.api.DocumentExporter;
import com.routedoc.service.api.OpenApiDocumentService;
import com.routedoc.service.api.ViewerPageRenderer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes {@code <filename>} and an {@code index.html} viewer page that loads it by relative URL.
 */
@Service
@Slf4j
public class DocumentExporterImpl implements DocumentExporter {

    static final String INDEX = "index.html";

    private final OpenApiDocumentService documentService;
    private final ViewerPageRenderer viewerPageRenderer;
    private final OpenApiProperties properties;

    public DocumentExporterImpl(OpenApiDocumentService documentService, ViewerPageRenderer viewerPageRenderer, OpenApiProperties properties) {
        this.documentService = documentService;
        this.viewerPageRenderer = viewerPageRenderer;
        this.properties = properties;
    }

    @Override
    public Path export(Path directory, String ui) {
        String json = documentService.getDocumentJson();
        String page = viewerPageRenderer.render(ui, properties.getFilename());
        Path documentFile = directory.resolve(properties.getFilename());
        try {
            Files.createDirectories(directory);
            Files.writeString(documentFile, json, StandardCharsets.UTF_8);
            Files.writeString(directory.resolve(INDEX), page, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to export OpenAPI document to {}", directory.toAbsolutePath(), e);
            throw new RouteDocException("Failed to export OpenAPI document to " + directory, e);
        }
        log.info("Exported OpenAPI document to {}", documentFile.toAbsolutePath());
        return documentFile;
    }
}
