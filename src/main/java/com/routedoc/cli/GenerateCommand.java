package com.routedoc.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.routedoc.config.OpenApiProperties;
import com.routedoc.dto.response.CommandResponse;
import com.routedoc.service.api.DocumentExporter;
import com.routedoc.service.api.OpenApiDocumentService;
import com.routedoc.service.api.ViewerPageRenderer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Commands producing the OpenAPI document and its viewer page.
 */
@ShellComponent
public class GenerateCommand {

    static final String APPLICATION_LOGGER = "com.routedoc";

    private final OpenApiDocumentService documentService;
    private final DocumentExporter documentExporter;
    private final ViewerPageRenderer viewerPageRenderer;
    private final OpenApiProperties properties;

    public GenerateCommand(OpenApiDocumentService documentService, DocumentExporter documentExporter,
                           ViewerPageRenderer viewerPageRenderer, OpenApiProperties properties) {
        this.documentService = documentService;
        this.documentExporter = documentExporter;
        this.viewerPageRenderer = viewerPageRenderer;
        this.properties = properties;
    }

    /**
     * Prints the document, or writes it to {@code output}.
     *
     * @param output  Optional file to write the document to.
     * @param verbose Logs every routing decision at debug level while the command runs.
     * @return The document JSON, or the colored outcome when writing to a file.
     */
    @ShellMethod(key = "generate", value = "Generates the OpenAPI document of the loaded routes.")
    public String generate(
            @ShellOption(value = {"--output", "-o"}, help = "File to write the document to.", defaultValue = ShellOption.NULL) String output,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        Logger appLogger = (Logger) LoggerFactory.getLogger(APPLICATION_LOGGER);
        Level originalLevel = appLogger.getLevel();
        if (verbose) {
            appLogger.setLevel(Level.DEBUG);
        }
        try {
            String json = documentService.getDocumentJson();
            if (output == null) {
                return json;
            }
            Path target = Path.of(output);
            Files.writeString(target, json, StandardCharsets.UTF_8);
            return CommandResponse.ok("Wrote OpenAPI document to '" + target.toAbsolutePath() + "'.").toAnsiString();
        } catch (Exception e) {
            return CommandResponse.failed("Failed to generate the document: " + e.getMessage()).toAnsiString();
        } finally {
            if (verbose) {
                appLogger.setLevel(originalLevel);
            }
        }
    }

    @ShellMethod(key = "export", value = "Writes the OpenAPI document and a viewer page to a directory.")
    public String export(
            @ShellOption(value = {"--directory", "-d"}, help = "Target directory.") String directory,
            @ShellOption(value = {"--ui"}, help = "Viewer: swagger or redoc.", defaultValue = ShellOption.NULL) String ui
    ) {
        try {
            Path written = documentExporter.export(Path.of(directory), ui != null ? ui : properties.getUi());
            return CommandResponse.ok("Exported OpenAPI document to '" + written + "'.").toAnsiString();
        } catch (Exception e) {
            return CommandResponse.failed("Failed to export the document: " + e.getMessage()).toAnsiString();
        }
    }

    /**
     * Prints the viewer page for the document served at the configured endpoint.
     */
    @ShellMethod(key = "viewer", value = "Prints the HTML viewer page for the served document.")
    public String viewer(@ShellOption(value = {"--ui"}, help = "Viewer: swagger or redoc.", defaultValue = ShellOption.NULL) String ui) {
        try {
            return viewerPageRenderer.render(ui != null ? ui : properties.getUi(), properties.documentUrl());
        } catch (Exception e) {
            return CommandResponse.failed(e.getMessage()).toAnsiString();
        }
    }
}
