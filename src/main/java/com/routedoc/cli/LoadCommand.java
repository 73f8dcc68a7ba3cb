package com.routedoc.cli;

import com.routedoc.dto.response.CommandResponse;
import com.routedoc.model.RouteTable;
import com.routedoc.service.api.OpenApiDocumentService;
import com.routedoc.service.api.RouteTableLoader;
import com.routedoc.service.api.RouteTableService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Loads the route table of the application to document.
 */
@ShellComponent
@Slf4j
public class LoadCommand {

    private final RouteTableLoader routeTableLoader;
    private final RouteTableService routeTableService;
    private final OpenApiDocumentService documentService;

    public LoadCommand(RouteTableLoader routeTableLoader, RouteTableService routeTableService, OpenApiDocumentService documentService) {
        this.routeTableLoader = routeTableLoader;
        this.routeTableService = routeTableService;
        this.documentService = documentService;
    }

    /**
     * Reads a route manifest and makes it the current route table.
     * <p>
     * Once the document has been generated it is not regenerated, so a table loaded afterwards
     * only takes effect after a restart; the response says so.
     *
     * @param source File path or {@code http(s)} URL of the route manifest.
     * @return The colored outcome.
     */
    @ShellMethod(key = "load", value = "Loads a route manifest from a file or URL.")
    public String load(@ShellOption(value = {"--source", "-s"}, help = "File path or URL of the route manifest.") String source) {
        CommandResponse response;
        try {
            RouteTable table = routeTableLoader.load(source);
            routeTableService.setRouteTable(source, table);
            if (documentService.isGenerated()) {
                log.warn("Route table replaced after the OpenAPI document was generated; the cached document is kept.");
                response = CommandResponse.ok("Loaded " + table.size() + " routes from '" + source
                        + "'. The document was already generated; restart to document the new routes.");
            } else {
                response = CommandResponse.ok("Loaded " + table.size() + " routes from '" + source + "'.");
            }
        } catch (Exception e) {
            response = CommandResponse.failed("Failed to load routes: " + e.getMessage());
        }
        return response.toAnsiString();
    }
}
