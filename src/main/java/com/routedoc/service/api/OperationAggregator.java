package com.routedoc.service.api;

import com.routedoc.model.HandlerMetadata;
import com.routedoc.model.Operation;
import com.routedoc.model.ParameterSpec;
import com.routedoc.service.support.SchemaRegistry;
import java.util.List;

/**
 * Builds the documentation of one (path, HTTP method) pair from the handler's metadata.
 */
public interface OperationAggregator {

    /**
     * Creates the operation object for a handler answering {@code method}.
     * <p>
     * Every declared data shape that carries a schema is registered into {@code registry} as a
     * side effect, so that the operation's {@code $ref}s resolve in the finished document.
     *
     * @param handler        The handler's metadata.
     * @param method         The HTTP method, any case. {@code HEAD} and {@code OPTIONS} are not
     *                       documented and are rejected.
     * @param pathParameters The parameters derived from the route template.
     * @param registry       The registry of the generation in progress.
     * @return The operation.
     */
    Operation aggregate(HandlerMetadata handler, String method, List<ParameterSpec> pathParameters, SchemaRegistry registry);
}
