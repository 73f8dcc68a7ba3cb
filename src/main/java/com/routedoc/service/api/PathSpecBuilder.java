package com.routedoc.service.api;

import com.routedoc.model.ParsedPath;

/**
 * Rewrites a route template into an OpenAPI path and its path parameters.
 */
public interface PathSpecBuilder {

    /**
     * Builds the OpenAPI form of a route template. For example {@code /items/<int(max=10):id>}
     * becomes {@code /items/{id}} with one required path parameter {@code id} of type integer.
     *
     * @param rule The route template.
     * @return The normalized path and one parameter per placeholder.
     * @throws com.routedoc.exception.RouteTemplateException if the template is invalid.
     */
    ParsedPath build(String rule);
}
