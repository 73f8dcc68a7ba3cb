package com.routedoc.service.support;

import com.routedoc.model.ConverterArguments;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a path converter to the JSON-schema fragment describing the values it accepts.
 * Unknown converters describe a plain string.
 */
public final class ConverterSchemaTable {

    private static final List<String> STRING_CONSTRAINTS = List.of("length", "maxLength", "minLength");

    private ConverterSchemaTable() {
    }

    public static Map<String, Object> schemaFor(String converter, ConverterArguments arguments) {
        ConverterArguments args = arguments == null ? ConverterArguments.none() : arguments;
        Map<String, Object> schema = new LinkedHashMap<>();
        switch (converter == null ? "default" : converter) {
            case "any": {
                Map<String, Object> items = new LinkedHashMap<>();
                items.put("type", "string");
                items.put("enum", new ArrayList<>(args.positional()));
                schema.put("type", "array");
                schema.put("items", items);
                break;
            }
            case "int":
                schema.put("type", "integer");
                schema.put("format", "int32");
                copyIfPresent(args.keyword(), "min", schema, "minimum");
                copyIfPresent(args.keyword(), "max", schema, "maximum");
                break;
            case "float":
                schema.put("type", "number");
                schema.put("format", "float");
                break;
            case "uuid":
                schema.put("type", "string");
                schema.put("format", "uuid");
                break;
            case "path":
                schema.put("type", "string");
                schema.put("format", "path");
                break;
            case "string":
                schema.put("type", "string");
                STRING_CONSTRAINTS.forEach(prop -> copyIfPresent(args.keyword(), prop, schema, prop));
                break;
            default:
                schema.put("type", "string");
        }
        return schema;
    }

    private static void copyIfPresent(Map<String, Object> source, String key, Map<String, Object> target, String targetKey) {
        if (source.containsKey(key)) {
            target.put(targetKey, source.get(key));
        }
    }
}
