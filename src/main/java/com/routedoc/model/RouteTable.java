package com.routedoc.model;

import java.util.List;

/**
 * The routes of an application, in the order the application registered them.
 *
 * @param routes The route definitions.
 */
public record RouteTable(List<RouteDefinition> routes) {

    public RouteTable {
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    public int size() {
        return routes.size();
    }
}
