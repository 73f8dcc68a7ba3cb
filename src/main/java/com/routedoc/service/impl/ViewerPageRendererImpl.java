package com.routedoc.service.impl;

import com.routedoc.exception.RouteDocException;
import com.routedoc.service.api.ViewerPageRenderer;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders {@code templates/<ui>.html} from the classpath, replacing {@code {{spec_url}}}.
 */
@Service
public class ViewerPageRendererImpl implements ViewerPageRenderer {

    static final Set<String> VIEWERS = Set.of("swagger", "redoc");
    private static final String PLACEHOLDER = "{{spec_url}}";

    @Override
    public String render(String ui, String specUrl) {
        String viewer = ui == null ? "" : ui.trim().toLowerCase(Locale.ROOT);
        if (!VIEWERS.contains(viewer)) {
            throw new RouteDocException("Unknown viewer '" + ui + "'. Expected 'swagger' or 'redoc'.");
        }
        return loadTemplate(viewer).replace(PLACEHOLDER, HtmlUtils.htmlEscape(specUrl));
    }

    private String loadTemplate(String viewer) {
        ClassPathResource resource = new ClassPathResource("templates/" + viewer + ".html");
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RouteDocException("Viewer template for '" + viewer + "' is missing", e);
        }
    }
}
