package com.routedoc.service.api;

import java.util.Map;

/**
 * Provides the OpenAPI document of the current route table.
 */
public interface OpenApiDocumentService {

    /**
     * Returns the document, generating it on the first call.
     * <p>
     * Every later call returns the same instance; the document is never regenerated within the
     * lifetime of the process, even if a different route table is loaded afterwards.
     *
     * @return The document.
     * @throws com.routedoc.exception.RouteDocException if no route table has been loaded yet.
     */
    Map<String, Object> getDocument();

    /**
     * @return {@code true} once the document has been generated.
     */
    boolean isGenerated();

    /**
     * @return The document serialized as pretty-printed JSON.
     */
    String getDocumentJson();
}
