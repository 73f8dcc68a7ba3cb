package com.routedoc.service.api;

import java.nio.file.Path;

/**
 * Writes the document and its viewer page to a directory, ready to be served statically.
 */
public interface DocumentExporter {

    /**
     * @param directory The target directory, created if missing.
     * @param ui        The viewer flavor, {@code swagger} or {@code redoc}.
     * @return The path of the written document.
     * @throws com.routedoc.exception.RouteDocException if writing fails.
     */
    Path export(Path directory, String ui);
}
