package com.routedoc.exception;

/**
 * Thrown when a route template contains stray angle brackets.
 */
public class MalformedTemplateException extends RouteTemplateException {

    public MalformedTemplateException(String rule) {
        super(rule, "malformed url rule: '" + rule + "'");
    }
}
