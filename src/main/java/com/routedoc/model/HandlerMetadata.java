package com.routedoc.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.Builder;

/**
 * Everything known about a route handler that feeds its documentation.
 * <p>
 * Each declaration is an explicit optional value rather than something discovered on the
 * handler at generation time. Absent collections are normalized to empty ones.
 *
 * @param name          The handler name; used for the operation id and as a summary fallback.
 * @param documentation Free text; the part before the first blank line becomes the summary.
 * @param query         The shape of the query string, if declared.
 * @param body          The shape of a JSON request body, if declared.
 * @param form          The shape of a form request body, if declared.
 * @param response      The shape of the successful response, if declared.
 * @param errors        Declared error responses, in declaration order.
 * @param tags          Tags grouping the operation.
 * @param scheme        Marker of the registration scheme that attached this metadata,
 *                      {@code null} when none did.
 */
@Builder(toBuilder = true)
public record HandlerMetadata(
        String name,
        String documentation,
        Optional<DeclaredSchema> query,
        Optional<DeclaredSchema> body,
        Optional<DeclaredSchema> form,
        Optional<DeclaredSchema> response,
        List<ApiError> errors,
        List<String> tags,
        String scheme) {

    public HandlerMetadata {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Handler name must not be blank.");
        }
        query = query == null ? Optional.empty() : query;
        body = body == null ? Optional.empty() : body;
        form = form == null ? Optional.empty() : form;
        response = response == null ? Optional.empty() : response;
        errors = errors == null ? List.of() : List.copyOf(errors);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static HandlerMetadata of(String name) {
        return builder().name(name).build();
    }

    /**
     * @return The declared shapes in query, body, form, response order.
     */
    public Stream<DeclaredSchema> declaredSchemas() {
        return Stream.of(query, body, form, response).flatMap(Optional::stream);
    }

    public boolean declaresAnySchema() {
        return declaredSchemas().findAny().isPresent();
    }
}
