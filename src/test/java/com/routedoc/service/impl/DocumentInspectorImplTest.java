package com.routedoc.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routedoc.exception.RouteDocException;
import com.routedoc.model.DocumentSummary;
import com.routedoc.model.DocumentSummary.InspectedOperation;
import com.routedoc.model.GenerationOptions;
import com.routedoc.model.RouteTable;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentInspectorImplTest {

    private final DocumentInspectorImpl inspector = new DocumentInspectorImpl();

    @Test
    void inspect_shouldSummarizeGeneratedDocument() throws Exception {
        URL resource = getClass().getClassLoader().getResource("routes-manifest.json");
        assertThat(resource).isNotNull();
        RouteTable table = new RouteTableLoaderImpl(WebClient.create())
                .parse(Files.readString(Paths.get(resource.toURI())), "routes-manifest.json");
        OpenApiGeneratorImpl generator = new OpenApiGeneratorImpl(
                new PathSpecBuilderImpl(new RouteTemplateParserImpl()), new OperationAggregatorImpl());
        GenerationOptions options = GenerationOptions.builder()
                .endpoint("/docs/new/")
                .openapiVersion("3.0.2")
                .info(Map.of("title", "Service Documents", "version", "latest"))
                .build();
        String json = new ObjectMapper().writeValueAsString(generator.generate(table, options));

        DocumentSummary summary = inspector.inspect(json);

        assertThat(summary.getOpenapiVersion()).isEqualTo("3.0.2");
        assertThat(summary.getTitle()).isEqualTo("Service Documents");
        assertThat(summary.getOperations()).containsKeys(
                "list_items__get", "create_item__post", "item_detail__get", "item_detail__delete", "download__get", "reports__get");
        assertThat(summary.getSchemaNames()).containsExactly("ItemQuery", "NewItem", "Item");

        InspectedOperation detail = summary.getOperations().get("item_detail__get");
        assertThat(detail.method()).isEqualTo("GET");
        assertThat(detail.path()).isEqualTo("/items/{item_id}");
        assertThat(detail.parameters()).containsExactly("item_id (path)");
        assertThat(detail.responses()).containsExactly("404", "200", "400");
    }

    @Test
    void inspect_shouldFallBackToMethodAndPathWithoutOperationId() {
        String json = "{\"openapi\": \"3.0.2\", \"info\": {\"title\": \"T\", \"version\": \"1\"},"
                + " \"paths\": {\"/ping\": {\"get\": {\"responses\": {\"200\": {\"description\": \"ok\"}}}}}}";

        DocumentSummary summary = inspector.inspect(json);

        assertThat(summary.getOperations()).containsOnlyKeys("get /ping");
        assertThat(summary.getSchemaNames()).isEmpty();
    }

    @Test
    void inspect_shouldRejectInvalidJson() {
        assertThatThrownBy(() -> inspector.inspect("{not json"))
                .isInstanceOf(RouteDocException.class)
                .hasMessageContaining("not valid JSON");
    }
}
