package com.routedoc.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routedoc.exception.RouteDocException;
import com.routedoc.model.DocumentSummary;
import com.routedoc.model.DocumentSummary.InspectedOperation;
import com.routedoc.service.api.DocumentInspector;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Uses swagger-parser to read documents, so that anything it cannot make sense of shows up in
 * {@link DocumentSummary#getMessages()}.
 */
@Service
@Slf4j
public class DocumentInspectorImpl implements DocumentInspector {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public DocumentSummary inspect(String json) {
        JsonNode raw = readTree(json);
        SwaggerParseResult result = new OpenAPIV3Parser().readContents(json, null, null);
        OpenAPI openAPI = result.getOpenAPI();
        if (openAPI == null) {
            throw new RouteDocException("Failed to parse the OpenAPI document: " + result.getMessages());
        }

        DocumentSummary summary = new DocumentSummary();
        summary.setOpenapiVersion(openAPI.getOpenapi());
        summary.setTitle(openAPI.getInfo() != null ? openAPI.getInfo().getTitle() : null);
        summary.setMessages(result.getMessages() != null ? result.getMessages() : Collections.emptyList());

        Map<String, InspectedOperation> operations = new LinkedHashMap<>();
        if (openAPI.getPaths() != null) {
            openAPI.getPaths().forEach((path, pathItem) -> pathItem.readOperationsMap()
                    .forEach((method, operation) -> {
                        InspectedOperation inspected = toInspected(method, operation, path, raw);
                        operations.put(inspected.operationId(), inspected);
                    }));
        }
        summary.setOperations(operations);

        if (openAPI.getComponents() != null && openAPI.getComponents().getSchemas() != null) {
            summary.setSchemaNames(new ArrayList<>(openAPI.getComponents().getSchemas().keySet()));
        } else {
            summary.setSchemaNames(Collections.emptyList());
        }
        log.info("Inspected OpenAPI document with {} operations and {} messages.", operations.size(), summary.getMessages().size());
        return summary;
    }

    private InspectedOperation toInspected(PathItem.HttpMethod method, Operation operation, String path, JsonNode raw) {
        String lowerMethod = method.name().toLowerCase(Locale.ROOT);
        // Documents written by route-doc carry "operationID", which the parser does not map to operationId.
        String operationId = operation.getOperationId() != null
                ? operation.getOperationId()
                : raw.path("paths").path(path).path(lowerMethod).path("operationID").asText(lowerMethod + " " + path);

        List<String> parameters = new ArrayList<>();
        if (operation.getParameters() != null) {
            for (Parameter parameter : operation.getParameters()) {
                parameters.add(parameter.getName() + " (" + parameter.getIn() + ")");
            }
        }
        List<String> responses = operation.getResponses() != null
                ? new ArrayList<>(operation.getResponses().keySet())
                : Collections.emptyList();

        return new InspectedOperation(operationId, method.name(), path, operation.getSummary(), parameters, responses);
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RouteDocException("The OpenAPI document is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
