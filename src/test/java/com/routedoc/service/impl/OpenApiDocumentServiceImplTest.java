package com.routedoc.service.impl;

import com.routedoc.config.OpenApiProperties;
import com.routedoc.exception.RouteDocException;
import com.routedoc.model.GenerationOptions;
import com.routedoc.model.InclusionMode;
import com.routedoc.model.RouteTable;
import com.routedoc.service.api.OpenApiGenerator;
import com.routedoc.service.api.RouteTableService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenApiDocumentServiceImplTest {

    @Mock
    private RouteTableService routeTableService;

    @Mock
    private OpenApiGenerator openApiGenerator;

    private OpenApiProperties properties;
    private OpenApiDocumentServiceImpl documentService;

    @BeforeEach
    void setUp() {
        properties = new OpenApiProperties();
        documentService = new OpenApiDocumentServiceImpl(routeTableService, openApiGenerator, properties);
    }

    @Test
    void getDocument_shouldGenerateOnceAndReturnSameInstance() {
        RouteTable table = new RouteTable(List.of());
        Map<String, Object> generated = new LinkedHashMap<>(Map.of("openapi", "3.0.2"));
        when(routeTableService.getRouteTable()).thenReturn(Optional.of(table));
        when(openApiGenerator.generate(eq(table), any(GenerationOptions.class))).thenReturn(generated);

        assertThat(documentService.isGenerated()).isFalse();
        Map<String, Object> first = documentService.getDocument();
        Map<String, Object> second = documentService.getDocument();

        assertThat(first).isSameAs(generated);
        assertThat(second).isSameAs(first);
        assertThat(documentService.isGenerated()).isTrue();
        verify(openApiGenerator, times(1)).generate(eq(table), any(GenerationOptions.class));
    }

    @Test
    void getDocument_shouldKeepFirstDocumentAfterRouteTableIsReplaced() {
        RouteTable first = new RouteTable(List.of());
        Map<String, Object> generated = new LinkedHashMap<>();
        when(routeTableService.getRouteTable()).thenReturn(Optional.of(first));
        when(openApiGenerator.generate(eq(first), any(GenerationOptions.class))).thenReturn(generated);

        documentService.getDocument();
        documentService.getDocument();

        verify(routeTableService, times(1)).getRouteTable();
        assertThat(documentService.getDocument()).isSameAs(generated);
    }

    @Test
    void getDocument_shouldPassConfiguredOptionsToGenerator() {
        properties.setMode("strict");
        properties.setUrlPrefix("/api");
        RouteTable table = new RouteTable(List.of());
        when(routeTableService.getRouteTable()).thenReturn(Optional.of(table));
        when(openApiGenerator.generate(eq(table), any(GenerationOptions.class))).thenReturn(new LinkedHashMap<>());

        documentService.getDocument();

        ArgumentCaptor<GenerationOptions> captor = ArgumentCaptor.forClass(GenerationOptions.class);
        verify(openApiGenerator).generate(eq(table), captor.capture());
        assertThat(captor.getValue().mode()).isEqualTo(InclusionMode.STRICT);
        assertThat(captor.getValue().servingPath()).isEqualTo("/api/docs/new/");
        assertThat(captor.getValue().info()).containsEntry("title", "Service Documents");
    }

    @Test
    void getDocument_shouldFailWithoutRouteTable() {
        when(routeTableService.getRouteTable()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> documentService.getDocument())
                .isInstanceOf(RouteDocException.class)
                .hasMessageContaining("No route table loaded");
        assertThat(documentService.isGenerated()).isFalse();
        verify(openApiGenerator, never()).generate(any(), any());
    }

    @Test
    void getDocument_shouldGenerateOnceUnderConcurrentFirstRequests() throws Exception {
        RouteTable table = new RouteTable(List.of());
        when(routeTableService.getRouteTable()).thenReturn(Optional.of(table));
        when(openApiGenerator.generate(eq(table), any(GenerationOptions.class))).thenAnswer(invocation -> {
            Thread.sleep(50);
            return new LinkedHashMap<String, Object>();
        });

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Map<String, Object>>> calls = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                calls.add(documentService::getDocument);
            }
            List<Future<Map<String, Object>>> results = executor.invokeAll(calls);
            Map<String, Object> expected = results.get(0).get();
            for (Future<Map<String, Object>> result : results) {
                assertThat(result.get()).isSameAs(expected);
            }
        } finally {
            executor.shutdownNow();
        }
        verify(openApiGenerator, times(1)).generate(eq(table), any(GenerationOptions.class));
    }

    @Test
    void getDocumentJson_shouldPrettyPrintDocument() {
        RouteTable table = new RouteTable(List.of());
        Map<String, Object> generated = new LinkedHashMap<>();
        generated.put("openapi", "3.0.2");
        when(routeTableService.getRouteTable()).thenReturn(Optional.of(table));
        when(openApiGenerator.generate(eq(table), any(GenerationOptions.class))).thenReturn(generated);

        String json = documentService.getDocumentJson();

        assertThat(json).contains("\"openapi\" : \"3.0.2\"");
        assertThat(json).contains(System.lineSeparator());
    }
}
