package com.routedoc.service.api;

import com.routedoc.model.DocumentSummary;

/**
 * Reads a generated OpenAPI document back and summarizes it.
 */
public interface DocumentInspector {

    /**
     * @param json The document JSON.
     * @return A summary of the document, including any problems the parser reported.
     * @throws com.routedoc.exception.RouteDocException if the content is not an OpenAPI document at all.
     */
    DocumentSummary inspect(String json);
}
