package com.routedoc.model;

import java.util.Map;
import java.util.Objects;

/**
 * A data shape declared on a handler, e.g. the type of its request body.
 * <p>
 * The {@code schema} is whatever the shape's JSON-schema description produced. It may carry a
 * nested {@code definitions} map, which is hoisted to the document level during generation.
 * A declaration without a schema body still produces a {@code $ref} to its name, which is then
 * left dangling in the document.
 *
 * @param name   The type name, used as the key under {@code components.schemas}.
 * @param schema The JSON-schema body, or {@code null} if only the name is known.
 */
public record DeclaredSchema(String name, Map<String, Object> schema) {

    public DeclaredSchema {
        Objects.requireNonNull(name, "name");
    }

    public static DeclaredSchema named(String name) {
        return new DeclaredSchema(name, null);
    }

    public boolean hasSchema() {
        return schema != null;
    }

    /**
     * @return A reference object pointing at this shape under {@code #/components/schemas}.
     */
    public Map<String, Object> ref() {
        return Map.of("$ref", "#/components/schemas/" + name);
    }
}
