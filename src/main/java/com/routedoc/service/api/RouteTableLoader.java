package com.routedoc.service.api;

import com.routedoc.model.RouteTable;

/**
 * Reads a route table from a JSON route manifest.
 */
public interface RouteTableLoader {

    /**
     * Loads a route manifest from a local file or an {@code http(s)} URL.
     *
     * @param source The file path or URL of the manifest.
     * @return The route table, in manifest order.
     * @throws com.routedoc.exception.RouteDocException if the manifest cannot be read or is invalid.
     */
    RouteTable load(String source);

    /**
     * Parses manifest content that has already been read.
     *
     * @param json   The manifest JSON.
     * @param origin A description of where the content came from, used in error messages.
     * @return The route table.
     */
    RouteTable parse(String json, String origin);
}
