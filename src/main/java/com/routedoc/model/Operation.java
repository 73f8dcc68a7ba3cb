package com.routedoc.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;

/**
 * The documented behavior of one (path, HTTP method) pair.
 * <p>
 * The id is serialized as {@code operationID}, the key existing consumers of the generated
 * documents read.
 *
 * @param summary     One-line summary.
 * @param description Longer description, empty when there is none.
 * @param operationId Handler name plus lower-case method, e.g. {@code get_item__get}.
 * @param tags        Tags grouping the operation.
 * @param parameters  Path parameters followed by the query parameter, if any.
 * @param requestBody The request body object, or {@code null}.
 * @param responses   Responses keyed by status code, in insertion order.
 */
@JsonPropertyOrder({"summary", "description", "operationID", "tags", "parameters", "requestBody", "responses"})
public record Operation(
        String summary,
        String description,
        @JsonProperty("operationID") String operationId,
        List<String> tags,
        List<ParameterSpec> parameters,
        @JsonInclude(JsonInclude.Include.NON_NULL) Map<String, Object> requestBody,
        Map<String, Object> responses) {
}
