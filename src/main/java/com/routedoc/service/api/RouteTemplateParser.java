package com.routedoc.service.api;

import com.routedoc.model.RouteSegment;
import java.util.stream.Stream;

/**
 * Splits a route template into static text and typed placeholders.
 */
public interface RouteTemplateParser {

    /**
     * Parses a route template such as {@code /items/<int(min=1):item_id>/tags}.
     * <p>
     * The returned stream is lazy and can be consumed once. Errors are raised while it is
     * consumed, at the segment where they are detected.
     *
     * @param rule The route template.
     * @return The segments of the template, in template order.
     * @throws com.routedoc.exception.DuplicateParameterNameException if a parameter name repeats.
     * @throws com.routedoc.exception.MalformedTemplateException if unparsed text contains
     *         {@code <} or {@code >}.
     */
    Stream<RouteSegment> parse(String rule);
}
