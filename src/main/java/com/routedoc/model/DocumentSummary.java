package com.routedoc.model;

import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * A condensed view of a generated OpenAPI document, as read back by swagger-parser.
 */
@Data
public class DocumentSummary {

    private String openapiVersion;

    private String title;

    /**
     * Operations keyed by their id, in document order.
     */
    private Map<String, InspectedOperation> operations;

    /**
     * Names under {@code components.schemas}.
     */
    private List<String> schemaNames;

    /**
     * Problems reported by the parser. Empty for a valid document.
     */
    private List<String> messages;

    /**
     * One operation of the inspected document.
     *
     * @param operationId The operation id.
     * @param method      The HTTP method, upper case.
     * @param path        The path, with {@code {name}} placeholders.
     * @param summary     The summary.
     * @param parameters  Parameter names with their location, e.g. {@code item_id (path)}.
     * @param responses   The documented status codes.
     */
    public record InspectedOperation(String operationId, String method, String path, String summary,
                                     List<String> parameters, List<String> responses) {
    }
}
