package com.routedoc.model;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One entry of a route table: a path template, the HTTP methods it answers and its handler.
 *
 * @param rule    The route template, e.g. {@code /items/<int:item_id>}.
 * @param methods The allowed HTTP methods, upper case, in declaration order.
 * @param handler The handler and its attached documentation metadata.
 */
public record RouteDefinition(String rule, Set<String> methods, HandlerMetadata handler) {

    public RouteDefinition {
        if (rule == null) {
            throw new IllegalArgumentException("Route rule must not be null.");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Route '" + rule + "' has no handler.");
        }
        methods = methods == null ? Set.of() : methods.stream()
                .map(m -> m.toUpperCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
