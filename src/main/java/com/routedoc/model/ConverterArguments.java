package com.routedoc.model;

import java.util.List;
import java.util.Map;

/**
 * The parsed form of a converter's argument string, e.g. {@code 'a', 'b', max=10}.
 *
 * @param positional Values given without a name, in declaration order.
 * @param keyword    Values given as {@code name=value}, in declaration order.
 */
public record ConverterArguments(List<Object> positional, Map<String, Object> keyword) {

    private static final ConverterArguments NONE = new ConverterArguments(List.of(), Map.of());

    public static ConverterArguments none() {
        return NONE;
    }
}
