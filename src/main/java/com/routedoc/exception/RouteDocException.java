package com.routedoc.exception;

/**
 * A runtime exception for application-specific errors within route-doc.
 * <p>
 * Signals failures in the application's logical flow, such as an unreadable route manifest,
 * an invalid configuration or a document that cannot be written.
 */
public class RouteDocException extends RuntimeException {

    /**
     * Constructs a new RouteDocException with the specified detail message.
     *
     * @param message The detail message.
     */
    public RouteDocException(String message) {
        super(message);
    }

    /**
     * Constructs a new RouteDocException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The cause, may be {@code null}.
     */
    public RouteDocException(String message, Throwable cause) {
        super(message, cause);
    }
}
