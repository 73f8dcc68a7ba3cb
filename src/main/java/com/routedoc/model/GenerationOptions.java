package com.routedoc.model;

import java.util.Map;
import lombok.Builder;

/**
 * The settings of one document generation.
 *
 * @param endpoint       The path the document itself is served under. Routes below it are skipped.
 * @param urlPrefix      Optional prefix in front of {@code endpoint}.
 * @param mode           The inclusion policy.
 * @param openapiVersion The value of the document's {@code openapi} field.
 * @param info           The document's {@code info} block.
 * @param extraProps     Overrides merged into the finished document.
 */
@Builder
public record GenerationOptions(
        String endpoint,
        String urlPrefix,
        InclusionMode mode,
        String openapiVersion,
        Map<String, Object> info,
        Map<String, Object> extraProps) {

    public GenerationOptions {
        endpoint = endpoint == null ? "" : endpoint;
        mode = mode == null ? InclusionMode.NORMAL : mode;
        info = info == null ? Map.of() : info;
        extraProps = extraProps == null ? Map.of() : extraProps;
    }

    /**
     * @return {@code urlPrefix + endpoint}; the prefix every route of the document's own
     *         serving surface starts with.
     */
    public String servingPath() {
        return (urlPrefix == null ? "" : urlPrefix) + endpoint;
    }
}
