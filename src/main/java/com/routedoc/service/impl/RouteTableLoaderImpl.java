package com.routedoc.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routedoc.exception.RouteDocException;
import com.routedoc.model.ApiError;
import com.routedoc.model.DeclaredSchema;
import com.routedoc.model.HandlerMetadata;
import com.routedoc.model.RouteDefinition;
import com.routedoc.model.RouteTable;
import com.routedoc.service.api.RouteTableLoader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Reads route manifests of the form
 * <pre>{@code
 * {
 *   "schemas": { "Item": { "type": "object", ... } },
 *   "routes": [
 *     { "rule": "/items/<int:item_id>", "methods": ["GET"], "handler": "get_item",
 *       "doc": "Get item", "response": "Item", "errors": [{"code": 404, "message": "Not found"}],
 *       "tags": ["items"], "scheme": "route-doc" }
 *   ]
 * }
 * }</pre>
 * Shape names ({@code query}, {@code body}, {@code form}, {@code response}) are resolved against
 * {@code schemas}. A name without an entry is kept as a name-only declaration. A route without
 * {@code methods} answers {@code GET}.
 */
@Service
@Slf4j
public class RouteTableLoaderImpl implements RouteTableLoader {

    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};

    private final WebClient webClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RouteTableLoaderImpl(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public RouteTable load(String source) {
        log.info("Loading route manifest from: {}", source);
        String json = isUrl(source) ? fetch(source) : read(source);
        RouteTable table = parse(json, source);
        log.info("Loaded {} routes from {}", table.size(), source);
        return table;
    }

    @Override
    public RouteTable parse(String json, String origin) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new RouteDocException("Route manifest from " + origin + " is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.path("routes").isArray()) {
            throw new RouteDocException("Route manifest from " + origin + " has no 'routes' array.");
        }

        JsonNode schemas = root.path("schemas");
        List<RouteDefinition> routes = new ArrayList<>();
        int index = 0;
        for (JsonNode route : root.path("routes")) {
            routes.add(parseRoute(route, schemas, origin, index++));
        }
        return new RouteTable(routes);
    }

    private RouteDefinition parseRoute(JsonNode route, JsonNode schemas, String origin, int index) {
        String rule = route.path("rule").asText(null);
        if (rule == null) {
            throw new RouteDocException("Route #" + index + " in " + origin + " has no 'rule'.");
        }
        String handlerName = route.path("handler").asText(null);
        if (handlerName == null || handlerName.isBlank()) {
            throw new RouteDocException("Route '" + rule + "' in " + origin + " has no 'handler'.");
        }

        Set<String> methods = new LinkedHashSet<>();
        if (route.path("methods").isArray()) {
            route.path("methods").forEach(m -> methods.add(m.asText()));
        } else {
            methods.add("GET");
        }

        HandlerMetadata handler = HandlerMetadata.builder()
                .name(handlerName)
                .documentation(route.path("doc").asText(null))
                .query(declaration(route, "query", schemas))
                .body(declaration(route, "body", schemas))
                .form(declaration(route, "form", schemas))
                .response(declaration(route, "response", schemas))
                .errors(errors(route.path("errors"), rule))
                .tags(StreamSupport.stream(route.path("tags").spliterator(), false).map(JsonNode::asText).toList())
                .scheme(route.path("scheme").asText(null))
                .build();

        return new RouteDefinition(rule, methods, handler);
    }

    private Optional<DeclaredSchema> declaration(JsonNode route, String field, JsonNode schemas) {
        String name = route.path(field).asText(null);
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        JsonNode schema = schemas.path(name);
        if (!schema.isObject()) {
            log.debug("Shape '{}' has no schema in the manifest; its reference will dangle.", name);
            return Optional.of(DeclaredSchema.named(name));
        }
        return Optional.of(new DeclaredSchema(name, objectMapper.convertValue(schema, OBJECT)));
    }

    private List<ApiError> errors(JsonNode errors, String rule) {
        List<ApiError> result = new ArrayList<>();
        for (JsonNode error : errors) {
            if (!error.path("code").canConvertToInt()) {
                throw new RouteDocException("Route '" + rule + "' declares an error without a numeric 'code'.");
            }
            result.add(new ApiError(error.path("code").asInt(), error.path("message").asText("")));
        }
        return result;
    }

    private String read(String source) {
        try {
            return Files.readString(Path.of(source), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RouteDocException("Failed to read route manifest file: " + source, e);
        }
    }

    private String fetch(String source) {
        try {
            String body = webClient.get().uri(source).retrieve().bodyToMono(String.class).block();
            if (body == null) {
                throw new RouteDocException("Route manifest at " + source + " is empty.");
            }
            return body;
        } catch (WebClientResponseException e) {
            log.error("Fetching route manifest from {} failed with status {}", source, e.getStatusCode());
            throw new RouteDocException("Failed to fetch route manifest from " + source + ": " + e.getStatusCode(), e);
        }
    }

    private static boolean isUrl(String source) {
        return source.startsWith("http://") || source.startsWith("https://");
    }
}
