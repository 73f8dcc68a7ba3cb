package com.routedoc.service.impl;

import com.routedoc.model.ApiError;
import com.routedoc.model.DeclaredSchema;
import com.routedoc.model.HandlerMetadata;
import com.routedoc.model.Operation;
import com.routedoc.model.ParameterSpec;
import com.routedoc.service.api.OperationAggregator;
import com.routedoc.service.support.SchemaRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Default {@link OperationAggregator}.
 * <p>
 * Responses are added in a fixed order: the declared errors, then the success response, then
 * the validation error response. The success response references the declared response shape;
 * without one, a bare {@code 200} is added unless a declared code already is a 2xx code. Any
 * declared input or output shape implies that the request can fail validation, which is
 * documented as a {@code 400}.
 */
@Service
public class OperationAggregatorImpl implements OperationAggregator {

    static final Set<String> UNDOCUMENTED_METHODS = Set.of("HEAD", "OPTIONS");

    private static final String JSON = "application/json";
    private static final String SUCCESS = "Successful Response";
    private static final String VALIDATION_ERROR = "Validation Error";

    @Override
    public Operation aggregate(HandlerMetadata handler, String method, List<ParameterSpec> pathParameters, SchemaRegistry registry) {
        String upperMethod = method.toUpperCase(Locale.ROOT);
        if (UNDOCUMENTED_METHODS.contains(upperMethod)) {
            throw new IllegalArgumentException("Method " + upperMethod + " is not documented.");
        }

        handler.declaredSchemas()
                .filter(DeclaredSchema::hasSchema)
                .forEach(shape -> registry.register(shape.name(), shape.schema()));

        String[] summaryAndDescription = splitDocumentation(handler.documentation());
        String summary = summaryAndDescription[0] != null ? summaryAndDescription[0] : capitalize(handler.name());
        String description = summaryAndDescription[1] != null ? summaryAndDescription[1] : "";

        List<ParameterSpec> parameters = new ArrayList<>(pathParameters);
        handler.query().ifPresent(query -> parameters.add(ParameterSpec.query(query.name(), query.ref())));

        return new Operation(
                summary,
                description,
                handler.name() + "__" + upperMethod.toLowerCase(Locale.ROOT),
                handler.tags(),
                Collections.unmodifiableList(parameters),
                requestBody(handler),
                responses(handler));
    }

    private Map<String, Object> requestBody(HandlerMetadata handler) {
        return handler.form()
                .or(handler::body)
                .map(shape -> Map.<String, Object>of("content", jsonContent(shape)))
                .orElse(null);
    }

    private Map<String, Object> responses(HandlerMetadata handler) {
        Map<String, Object> responses = new LinkedHashMap<>();
        boolean has2xx = false;
        for (ApiError error : handler.errors()) {
            String code = String.valueOf(error.code());
            if (code.startsWith("2")) {
                has2xx = true;
            }
            responses.put(code, describe(error.message()));
        }

        if (handler.response().isPresent()) {
            Map<String, Object> success = describe(SUCCESS);
            success.put("content", jsonContent(handler.response().get()));
            responses.put("200", success);
        } else if (!has2xx) {
            responses.put("200", describe(SUCCESS));
        }

        if (handler.declaresAnySchema()) {
            responses.put("400", describe(VALIDATION_ERROR));
        }
        return responses;
    }

    private static Map<String, Object> describe(String description) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("description", description);
        return response;
    }

    private static Map<String, Object> jsonContent(DeclaredSchema shape) {
        return Map.of(JSON, Map.of("schema", shape.ref()));
    }

    /**
     * Splits documentation text on its first blank line.
     *
     * @return Summary and description, each {@code null} when absent.
     */
    static String[] splitDocumentation(String documentation) {
        if (documentation == null) {
            return new String[]{null, null};
        }
        String doc = documentation.replace("\r\n", "\n").strip();
        if (doc.isEmpty()) {
            return new String[]{null, null};
        }
        int blank = doc.indexOf("\n\n");
        if (blank < 0) {
            return new String[]{doc, null};
        }
        String summary = doc.substring(0, blank);
        String description = doc.substring(blank + 2);
        return new String[]{summary.isEmpty() ? null : summary, description.isEmpty() ? null : description};
    }

    /**
     * Upper-cases the first character and lower-cases the rest, {@code get_Item} becomes
     * {@code Get_item}.
     */
    static String capitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1).toLowerCase(Locale.ROOT);
    }
}
