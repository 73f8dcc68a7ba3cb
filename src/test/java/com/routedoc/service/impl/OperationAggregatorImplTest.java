package com.routedoc.service.impl;

import com.routedoc.model.ApiError;
import com.routedoc.model.DeclaredSchema;
import com.routedoc.model.HandlerMetadata;
import com.routedoc.model.Operation;
import com.routedoc.model.ParameterSpec;
import com.routedoc.service.support.SchemaRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationAggregatorImplTest {

    private static final DeclaredSchema ITEM = new DeclaredSchema("Item", Map.of("type", "object"));
    private static final DeclaredSchema NEW_ITEM = new DeclaredSchema("NewItem", Map.of("type", "object"));
    private static final DeclaredSchema ITEM_FORM = new DeclaredSchema("ItemForm", Map.of("type", "object"));
    private static final DeclaredSchema ITEM_QUERY = new DeclaredSchema("ItemQuery", Map.of("type", "object"));

    private OperationAggregatorImpl aggregator;
    private SchemaRegistry registry;

    @BeforeEach
    void setUp() {
        aggregator = new OperationAggregatorImpl();
        registry = new SchemaRegistry();
    }

    @Test
    void aggregate_shouldDocumentUndecoratedHandler() {
        Operation operation = aggregator.aggregate(HandlerMetadata.of("list_items"), "GET", List.of(), registry);

        assertThat(operation.summary()).isEqualTo("List_items");
        assertThat(operation.description()).isEmpty();
        assertThat(operation.operationId()).isEqualTo("list_items__get");
        assertThat(operation.tags()).isEmpty();
        assertThat(operation.parameters()).isEmpty();
        assertThat(operation.requestBody()).isNull();
        assertThat(operation.responses()).isEqualTo(Map.of("200", Map.of("description", "Successful Response")));
        assertThat(registry.names()).isEmpty();
    }

    @Test
    void aggregate_shouldSplitDocumentationOnFirstBlankLine() {
        HandlerMetadata handler = HandlerMetadata.builder()
                .name("get_item")
                .documentation("\n  Fetch one item\n\nLooks the item up by id.\n\nNever cached.  \n")
                .build();

        Operation operation = aggregator.aggregate(handler, "get", List.of(), registry);

        assertThat(operation.summary()).isEqualTo("Fetch one item");
        assertThat(operation.description()).isEqualTo("Looks the item up by id.\n\nNever cached.");
        assertThat(operation.operationId()).isEqualTo("get_item__get");
    }

    @Test
    void aggregate_shouldUseWholeSingleParagraphAsSummary() {
        HandlerMetadata handler = HandlerMetadata.builder().name("ping").documentation("Health check\r\nstill summary").build();

        Operation operation = aggregator.aggregate(handler, "GET", List.of(), registry);

        assertThat(operation.summary()).isEqualTo("Health check\nstill summary");
        assertThat(operation.description()).isEmpty();
    }

    @Test
    void aggregate_shouldFallBackToCapitalizedNameForBlankDocumentation() {
        HandlerMetadata handler = HandlerMetadata.builder().name("get_ITEM").documentation("   ").build();

        assertThat(aggregator.aggregate(handler, "GET", List.of(), registry).summary()).isEqualTo("Get_item");
    }

    @Test
    void aggregate_shouldAppendQueryParameterAfterPathParameters() {
        ParameterSpec id = ParameterSpec.path("item_id", Map.of("type", "integer", "format", "int32"));
        HandlerMetadata handler = HandlerMetadata.builder().name("search").query(Optional.of(ITEM_QUERY)).build();

        Operation operation = aggregator.aggregate(handler, "GET", List.of(id), registry);

        assertThat(operation.parameters()).containsExactly(
                id,
                new ParameterSpec("ItemQuery", "query", true, Map.of("$ref", "#/components/schemas/ItemQuery")));
        assertThat(registry.names()).containsExactly("ItemQuery");
    }

    @Test
    void aggregate_shouldPreferFormOverBodyForRequestBody() {
        HandlerMetadata handler = HandlerMetadata.builder()
                .name("create_item")
                .body(Optional.of(NEW_ITEM))
                .form(Optional.of(ITEM_FORM))
                .build();

        Operation operation = aggregator.aggregate(handler, "POST", List.of(), registry);

        assertThat(operation.requestBody()).isEqualTo(Map.of("content",
                Map.of("application/json", Map.of("schema", Map.of("$ref", "#/components/schemas/ItemForm")))));
        assertThat(registry.names()).containsExactly("NewItem", "ItemForm");
    }

    @Test
    void aggregate_shouldOrderErrorsBeforeSuccessBeforeValidation() {
        HandlerMetadata handler = HandlerMetadata.builder()
                .name("update_item")
                .body(Optional.of(NEW_ITEM))
                .response(Optional.of(ITEM))
                .errors(List.of(new ApiError(409, "Conflict"), new ApiError(404, "Not found")))
                .build();

        Operation operation = aggregator.aggregate(handler, "PUT", List.of(), registry);

        assertThat(operation.responses()).containsOnlyKeys("409", "404", "200", "400");
        assertThat(operation.responses().keySet()).containsExactly("409", "404", "200", "400");
        assertThat(operation.responses().get("200")).isEqualTo(Map.of(
                "description", "Successful Response",
                "content", Map.of("application/json", Map.of("schema", Map.of("$ref", "#/components/schemas/Item")))));
        assertThat(operation.responses().get("400")).isEqualTo(Map.of("description", "Validation Error"));
    }

    @Test
    void aggregate_shouldNotAddBareSuccessWhenA2xxErrorIsDeclared() {
        HandlerMetadata handler = HandlerMetadata.builder()
                .name("accept")
                .errors(List.of(new ApiError(202, "Accepted")))
                .build();

        Operation operation = aggregator.aggregate(handler, "POST", List.of(), registry);

        assertThat(operation.responses()).isEqualTo(Map.of("202", Map.of("description", "Accepted")));
    }

    @Test
    void aggregate_shouldAddValidationErrorForResponseShapeAlone() {
        HandlerMetadata handler = HandlerMetadata.builder().name("report").response(Optional.of(DeclaredSchema.named("Report"))).build();

        Operation operation = aggregator.aggregate(handler, "GET", List.of(), registry);

        assertThat(operation.responses().keySet()).containsExactly("200", "400");
        assertThat(registry.names()).isEmpty();
    }

    @Test
    void aggregate_shouldLowerCaseMethodInOperationId() {
        assertThat(aggregator.aggregate(HandlerMetadata.of("remove"), "Delete", List.of(), registry).operationId())
                .isEqualTo("remove__delete");
    }

    @Test
    void aggregate_shouldRejectUndocumentedMethods() {
        assertThatThrownBy(() -> aggregator.aggregate(HandlerMetadata.of("probe"), "head", List.of(), registry))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("HEAD");
        assertThatThrownBy(() -> aggregator.aggregate(HandlerMetadata.of("probe"), "OPTIONS", List.of(), registry))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
