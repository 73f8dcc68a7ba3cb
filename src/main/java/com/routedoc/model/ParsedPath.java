package com.routedoc.model;

import java.util.List;

/**
 * A route template rewritten into OpenAPI form.
 *
 * @param path       The normalized path, with every placeholder rendered as {@code {name}}.
 * @param parameters One path parameter per placeholder, in template order.
 */
public record ParsedPath(String path, List<ParameterSpec> parameters) {
}
