package com.routedoc.service.support;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects the JSON schemas of the data shapes met while generating one document.
 * <p>
 * Names are unique: registering a name twice silently keeps the later schema. Once every route
 * has been visited, {@link #flatten()} moves the nested {@code definitions} of all registered
 * schemas to one top-level map. An instance serves a single generation and is not thread-safe.
 */
@Slf4j
public class SchemaRegistry {

    private static final String DEFINITIONS = "definitions";

    private final Map<String, Map<String, Object>> schemas = new LinkedHashMap<>();
    private boolean flattened;

    /**
     * Registers a schema under a name, replacing any schema registered under the same name.
     * The body is copied, so later flattening leaves the caller's map untouched.
     */
    public void register(String name, Map<String, Object> schema) {
        if (flattened) {
            throw new IllegalStateException("Schema registry has already been flattened.");
        }
        Map<String, Object> previous = schemas.put(name, JsonMerge.deepCopy(schema));
        if (previous != null) {
            log.debug("Schema '{}' registered again, the later declaration wins.", name);
        }
    }

    public boolean contains(String name) {
        return schemas.containsKey(name);
    }

    /**
     * @return The registered schemas in registration order.
     */
    public Map<String, Map<String, Object>> schemas() {
        return Collections.unmodifiableMap(schemas);
    }

    /**
     * Hoists every nested {@code definitions} entry to a single map and removes the nested
     * maps from their parents. May only be called once.
     *
     * @return The hoisted definitions; on a name clash the later schema's entry wins.
     */
    public Map<String, Object> flatten() {
        if (flattened) {
            throw new IllegalStateException("Schema registry has already been flattened.");
        }
        flattened = true;
        Map<String, Object> definitions = new LinkedHashMap<>();
        schemas.forEach((name, schema) -> {
            Object nested = schema.remove(DEFINITIONS);
            if (nested instanceof Map) {
                ((Map<?, ?>) nested).forEach((key, value) -> definitions.put(String.valueOf(key), value));
            } else if (nested != null) {
                log.debug("Ignoring non-object definitions of schema '{}'.", name);
            }
        });
        return definitions;
    }

    public List<String> names() {
        return List.copyOf(schemas.keySet());
    }
}
