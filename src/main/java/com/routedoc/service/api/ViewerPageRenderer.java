package com.routedoc.service.api;

/**
 * Renders the HTML page that displays a document with Swagger UI or ReDoc.
 */
public interface ViewerPageRenderer {

    /**
     * @param ui      {@code swagger} or {@code redoc}.
     * @param specUrl The URL the page loads the document from.
     * @return The HTML page.
     * @throws com.routedoc.exception.RouteDocException if the viewer is unknown.
     */
    String render(String ui, String specUrl);
}
