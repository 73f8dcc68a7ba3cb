package com.routedoc.exception;

/**
 * Thrown when a route template cannot be parsed. Aborts the generation of the whole document.
 */
public class RouteTemplateException extends RouteDocException {

    private final String rule;

    public RouteTemplateException(String rule, String message) {
        super(message);
        this.rule = rule;
    }

    /**
     * @return The offending route template.
     */
    public String getRule() {
        return rule;
    }
}
