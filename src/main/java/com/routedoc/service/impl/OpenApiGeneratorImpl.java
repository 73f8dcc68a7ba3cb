package com.routedoc.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routedoc.model.GenerationOptions;
import com.routedoc.model.Operation;
import com.routedoc.model.ParsedPath;
import com.routedoc.model.RouteDefinition;
import com.routedoc.model.RouteTable;
import com.routedoc.service.api.OpenApiGenerator;
import com.routedoc.service.api.OperationAggregator;
import com.routedoc.service.api.PathSpecBuilder;
import com.routedoc.service.support.JsonMerge;
import com.routedoc.service.support.SchemaRegistry;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default {@link OpenApiGenerator}.
 * <p>
 * Routes below the document's own serving path and below {@code /static} are never documented.
 * Each remaining template is parsed before the inclusion policy is applied, so an invalid template
 * fails the generation even when its handler would have been left out. A path item is created for
 * every included route, including one whose only methods are {@code HEAD} and {@code OPTIONS}.
 * Routes that normalize to the same path share one path item.
 */
@Service
@Slf4j
public class OpenApiGeneratorImpl implements OpenApiGenerator {

    static final String STATIC_PREFIX = "/static";

    private static final TypeReference<Map<String, Object>> TREE = new TypeReference<>() {};

    private final PathSpecBuilder pathSpecBuilder;
    private final OperationAggregator operationAggregator;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenApiGeneratorImpl(PathSpecBuilder pathSpecBuilder, OperationAggregator operationAggregator) {
        this.pathSpecBuilder = pathSpecBuilder;
        this.operationAggregator = operationAggregator;
    }

    @Override
    public Map<String, Object> generate(RouteTable routeTable, GenerationOptions options) {
        log.info("Generating OpenAPI document from {} routes in {} mode.", routeTable.size(), options.mode().name().toLowerCase(Locale.ROOT));
        SchemaRegistry registry = new SchemaRegistry();
        Map<String, Map<String, Object>> paths = new LinkedHashMap<>();
        Map<String, Map<String, String>> tags = new LinkedHashMap<>();
        String servingPath = options.servingPath();

        for (RouteDefinition route : routeTable.routes()) {
            String rule = route.rule();
            if (rule.startsWith(servingPath) || rule.startsWith(STATIC_PREFIX)) {
                log.debug("Skipping '{}', it belongs to the documentation or static surface.", rule);
                continue;
            }

            ParsedPath parsed = pathSpecBuilder.build(rule);

            if (options.mode().bypasses(route.handler().scheme(), SCHEME)) {
                log.debug("Bypassing '{}', handler '{}' is registered by scheme '{}'.", rule, route.handler().name(), route.handler().scheme());
                continue;
            }

            Map<String, Object> pathItem = paths.computeIfAbsent(parsed.path(), p -> new LinkedHashMap<>());
            for (String method : route.methods()) {
                if (OperationAggregatorImpl.UNDOCUMENTED_METHODS.contains(method)) {
                    continue;
                }
                route.handler().tags().forEach(tag -> tags.computeIfAbsent(tag, name -> Map.of("name", name)));
                Operation operation = operationAggregator.aggregate(route.handler(), method, parsed.parameters(), registry);
                pathItem.put(method.toLowerCase(Locale.ROOT), toTree(operation));
            }
        }

        Map<String, Object> definitions = registry.flatten();

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("openapi", options.openapiVersion());
        document.put("info", JsonMerge.deepCopy(options.info()));
        document.put("tags", tags.values().stream().map(LinkedHashMap<String, Object>::new).collect(Collectors.toList()));
        document.put("paths", new LinkedHashMap<String, Object>(paths));
        Map<String, Object> components = new LinkedHashMap<>();
        components.put("schemas", new LinkedHashMap<String, Object>(registry.schemas()));
        document.put("components", components);
        document.put("definitions", definitions);

        JsonMerge.merge(document, options.extraProps());

        log.info("Generated OpenAPI document with {} paths and {} schemas.", paths.size(), registry.schemas().size());
        return document;
    }

    private Map<String, Object> toTree(Operation operation) {
        return objectMapper.convertValue(operation, TREE);
    }
}
