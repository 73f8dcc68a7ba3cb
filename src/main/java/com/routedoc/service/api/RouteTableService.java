package com.routedoc.service.api;

import com.routedoc.model.RouteTable;
import java.util.Optional;

/**
 * Holds the route table of the application being documented.
 */
public interface RouteTableService {

    /**
     * Replaces the current route table.
     *
     * @param source Where the table was loaded from.
     * @param table  The new table.
     */
    void setRouteTable(String source, RouteTable table);

    /**
     * @return The current route table, or empty if none has been loaded.
     */
    Optional<RouteTable> getRouteTable();

    /**
     * @return Where the current table was loaded from, or empty if none has been loaded.
     */
    Optional<String> getSource();
}
