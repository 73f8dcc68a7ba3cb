package com.routedoc.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/**
 * A single operation parameter as it appears in the generated document.
 *
 * @param name     The parameter name.
 * @param in       The location of the parameter, {@code "path"} or {@code "query"}.
 * @param required Whether the parameter is required. Path parameters always are.
 * @param schema   The JSON-schema fragment describing the value.
 */
@JsonPropertyOrder({"name", "in", "required", "schema"})
public record ParameterSpec(String name, String in, boolean required, Map<String, Object> schema) {

    public static ParameterSpec path(String name, Map<String, Object> schema) {
        return new ParameterSpec(name, "path", true, schema);
    }

    public static ParameterSpec query(String name, Map<String, Object> schema) {
        return new ParameterSpec(name, "query", true, schema);
    }
}
