package com.routedoc.exception;

/**
 * Thrown when a route template uses the same parameter name twice.
 */
public class DuplicateParameterNameException extends RouteTemplateException {

    private final String variable;

    public DuplicateParameterNameException(String rule, String variable) {
        super(rule, "variable name '" + variable + "' used twice.");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
