package com.routedoc.config;

import com.routedoc.model.RouteTable;
import com.routedoc.service.api.RouteTableLoader;
import com.routedoc.service.api.RouteTableService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Loads the route manifest named by {@code ROUTEDOC_ROUTES} on start-up, so the shell is ready to
 * generate without a {@code load} command. A manifest that fails to load is reported and skipped.
 */
@Component
@Profile("!test")
@Slf4j
public class AutoLoadRunner implements CommandLineRunner {

    @Value("${ROUTEDOC_ROUTES:}")
    private String routesSource;

    private final RouteTableLoader routeTableLoader;
    private final RouteTableService routeTableService;

    public AutoLoadRunner(RouteTableLoader routeTableLoader, RouteTableService routeTableService) {
        this.routeTableLoader = routeTableLoader;
        this.routeTableService = routeTableService;
    }

    @Override
    public void run(String... args) {
        if (routesSource == null || routesSource.isBlank()) {
            log.debug("ROUTEDOC_ROUTES not set, no route manifest loaded on start-up.");
            return;
        }
        try {
            RouteTable table = routeTableLoader.load(routesSource);
            routeTableService.setRouteTable(routesSource, table);
        } catch (Exception e) {
            log.error("Could not load route manifest '{}' on start-up: {}", routesSource, e.getMessage());
        }
    }
}
