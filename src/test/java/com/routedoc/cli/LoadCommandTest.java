package com.routedoc.cli;

import com.routedoc.exception.RouteDocException;
import com.routedoc.model.HandlerMetadata;
import com.routedoc.model.RouteDefinition;
import com.routedoc.model.RouteTable;
import com.routedoc.service.api.OpenApiDocumentService;
import com.routedoc.service.api.RouteTableLoader;
import com.routedoc.service.api.RouteTableService;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LoadCommandTest {

    @Mock
    private RouteTableLoader routeTableLoader;

    @Mock
    private RouteTableService routeTableService;

    @Mock
    private OpenApiDocumentService documentService;

    private LoadCommand loadCommand;

    @BeforeEach
    void setUp() {
        loadCommand = new LoadCommand(routeTableLoader, routeTableService, documentService);
    }

    @Test
    void load_shouldStoreLoadedRouteTable() {
        RouteTable table = new RouteTable(List.of(new RouteDefinition("/ping", Set.of("GET"), HandlerMetadata.of("ping"))));
        when(routeTableLoader.load("routes.json")).thenReturn(table);

        String result = loadCommand.load("routes.json");

        verify(routeTableService).setRouteTable("routes.json", table);
        assertThat(result).contains("Loaded 1 routes from 'routes.json'.");
        assertThat(result).startsWith("\u001B[32m");
    }

    @Test
    void load_shouldWarnWhenDocumentWasAlreadyGenerated() {
        when(routeTableLoader.load("routes.json")).thenReturn(new RouteTable(List.of()));
        when(documentService.isGenerated()).thenReturn(true);

        String result = loadCommand.load("routes.json");

        assertThat(result).contains("restart to document the new routes");
    }

    @Test
    void load_shouldReportFailureWithoutReplacingTable() {
        when(routeTableLoader.load(anyString())).thenThrow(new RouteDocException("Failed to read route manifest file: x.json"));

        String result = loadCommand.load("x.json");

        assertThat(result).startsWith("\u001B[31m");
        assertThat(result).contains("Failed to load routes: Failed to read route manifest file: x.json");
        verify(routeTableService, never()).setRouteTable(anyString(), any());
    }
}
