package com.routedoc.config;

import com.routedoc.model.GenerationOptions;
import com.routedoc.model.InclusionMode;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized settings of the generated document and of the surface serving it, bound from
 * {@code routedoc.openapi.*}.
 */
@Data
@ConfigurationProperties(prefix = "routedoc.openapi")
public class OpenApiProperties {

    /**
     * Path the document and its viewer are served under. Routes below it are not documented.
     */
    private String endpoint = "/docs/new/";

    /**
     * Optional prefix in front of {@link #endpoint}.
     */
    private String urlPrefix;

    /**
     * Inclusion policy: {@code normal}, {@code greedy} or {@code strict}.
     */
    private String mode = "normal";

    /**
     * Value of the document's {@code openapi} field.
     */
    private String version = "3.0.2";

    private Map<String, Object> info = defaultInfo();

    /**
     * Overrides merged into the generated document, e.g.
     * {@code routedoc.openapi.extra-props.servers[0].url=https://api.example.com}.
     */
    private Map<String, Object> extraProps = new LinkedHashMap<>();

    /**
     * Viewer page flavor: {@code swagger} or {@code redoc}.
     */
    private String ui = "swagger";

    /**
     * File name of the document below {@link #endpoint}.
     */
    private String filename = "openapi.json";

    public GenerationOptions toGenerationOptions() {
        return GenerationOptions.builder()
                .endpoint(endpoint)
                .urlPrefix(urlPrefix)
                .mode(InclusionMode.fromValue(mode))
                .openapiVersion(version)
                .info(info)
                .extraProps(extraProps)
                .build();
    }

    /**
     * @return The URL the viewer page loads the document from.
     */
    public String documentUrl() {
        return (urlPrefix == null ? "" : urlPrefix) + endpoint + filename;
    }

    private static Map<String, Object> defaultInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("title", "Service Documents");
        info.put("version", "latest");
        return info;
    }
}
