package com.routedoc.service.api;

import com.routedoc.model.GenerationOptions;
import com.routedoc.model.RouteTable;
import java.util.Map;

/**
 * Assembles an OpenAPI document from a route table.
 */
public interface OpenApiGenerator {

    /**
     * The scheme marker route-doc attaches to handler metadata it registered itself.
     */
    String SCHEME = "route-doc";

    /**
     * Generates a fresh document on every call.
     *
     * @param routeTable The routes to document, visited in table order.
     * @param options    Serving path, inclusion policy, info block and overrides.
     * @return The document as a mutable, insertion-ordered JSON tree.
     * @throws com.routedoc.exception.RouteTemplateException if any visited route template is
     *         invalid; the whole generation is aborted.
     */
    Map<String, Object> generate(RouteTable routeTable, GenerationOptions options);
}
