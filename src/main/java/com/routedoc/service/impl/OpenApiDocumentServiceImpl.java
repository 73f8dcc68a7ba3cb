package com.routedoc.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.routedoc.config.OpenApiProperties;
import com.routedoc.exception.RouteDocException;
import com.routedoc.model.RouteTable;
import com.routedoc.service.api.OpenApiDocumentService;
import com.routedoc.service.api.OpenApiGenerator;
import com.routedoc.service.api.RouteTableService;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates the document once, from the route table held by the {@link RouteTableService} at the
 * time of the first request, and memoizes it.
 * <p>
 * Generation runs under the instance lock, so concurrent first requests generate the document
 * only once.
 */
@Service
@Slf4j
public class OpenApiDocumentServiceImpl implements OpenApiDocumentService {

    private final RouteTableService routeTableService;
    private final OpenApiGenerator openApiGenerator;
    private final OpenApiProperties properties;
    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private Map<String, Object> document;

    public OpenApiDocumentServiceImpl(RouteTableService routeTableService, OpenApiGenerator openApiGenerator, OpenApiProperties properties) {
        this.routeTableService = routeTableService;
        this.openApiGenerator = openApiGenerator;
        this.properties = properties;
    }

    @Override
    public synchronized Map<String, Object> getDocument() {
        if (document == null) {
            RouteTable table = routeTableService.getRouteTable()
                    .orElseThrow(() -> new RouteDocException("No route table loaded. Use 'load' first."));
            document = openApiGenerator.generate(table, properties.toGenerationOptions());
            log.info("Cached OpenAPI document for routes from {}", routeTableService.getSource().orElse("<unknown>"));
        }
        return document;
    }

    @Override
    public synchronized boolean isGenerated() {
        return document != null;
    }

    @Override
    public String getDocumentJson() {
        try {
            return jsonMapper.writeValueAsString(getDocument());
        } catch (JsonProcessingException e) {
            throw new RouteDocException("Failed to serialize the OpenAPI document", e);
        }
    }
}
