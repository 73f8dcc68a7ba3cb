package com.routedoc.cli;

import com.routedoc.dto.response.CommandResponse;
import com.routedoc.model.DocumentSummary;
import com.routedoc.model.DocumentSummary.InspectedOperation;
import com.routedoc.service.api.DocumentInspector;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Summarizes a generated OpenAPI document.
 */
@ShellComponent
public class InspectCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_PURPLE = "\u001B[35m";

    private final DocumentInspector documentInspector;

    public InspectCommand(DocumentInspector documentInspector) {
        this.documentInspector = documentInspector;
    }

    /**
     * Lists the operations of a document file, or the details of one operation.
     *
     * @param file        The document file.
     * @param operationId Optional id of the operation to show.
     * @return The formatted summary.
     */
    @ShellMethod(key = "inspect", value = "Shows the operations of a generated OpenAPI document.")
    public String inspect(
            @ShellOption(value = {"--file", "-f"}, help = "The OpenAPI document file.") String file,
            @ShellOption(value = {"--operation", "-o"}, help = "The operation ID to show.", defaultValue = ShellOption.NULL) String operationId
    ) {
        DocumentSummary summary;
        try {
            summary = documentInspector.inspect(Files.readString(Path.of(file), StandardCharsets.UTF_8));
        } catch (IOException e) {
            return CommandResponse.failed("Could not read '" + file + "': " + e.getMessage()).toAnsiString();
        } catch (Exception e) {
            return CommandResponse.failed(e.getMessage()).toAnsiString();
        }

        StringBuilder out = new StringBuilder();
        if (operationId != null) {
            InspectedOperation operation = summary.getOperations().get(operationId);
            if (operation == null) {
                return CommandResponse.failed("Operation ID '" + operationId + "' not found in '" + file + "'.").toAnsiString();
            }
            out.append(ANSI_CYAN).append("Details for Operation: ").append(ANSI_YELLOW).append(operationId).append(ANSI_RESET).append('\n');
            appendOperation(out, operation);
            return out.toString();
        }

        out.append(ANSI_CYAN).append(summary.getTitle()).append(" (OpenAPI ").append(summary.getOpenapiVersion()).append(")")
                .append(ANSI_RESET).append('\n');
        summary.getOperations().values().forEach(op -> appendOperation(out, op));
        if (!summary.getSchemaNames().isEmpty()) {
            out.append(ANSI_CYAN).append("Schemas: ").append(ANSI_RESET).append(String.join(", ", summary.getSchemaNames())).append('\n');
        }
        summary.getMessages().forEach(m -> out.append(ANSI_YELLOW).append("  ! ").append(m).append(ANSI_RESET).append('\n'));
        return out.toString();
    }

    private void appendOperation(StringBuilder out, InspectedOperation op) {
        out.append("-".repeat(50)).append('\n');
        out.append(ANSI_GREEN).append("Operation ID: ").append(ANSI_YELLOW).append(op.operationId()).append(ANSI_RESET).append('\n');
        out.append("  ").append(ANSI_PURPLE).append(op.method()).append(ANSI_RESET).append(' ').append(op.path()).append('\n');
        out.append("  Summary: ").append(op.summary()).append('\n');
        if (!op.parameters().isEmpty()) {
            out.append("  Parameters: ").append(String.join(", ", op.parameters())).append('\n');
        }
        out.append("  Responses: ").append(String.join(", ", op.responses())).append('\n');
    }
}
