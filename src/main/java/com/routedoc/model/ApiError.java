package com.routedoc.model;

/**
 * An error response a handler declares it can produce.
 *
 * @param code    The HTTP status code.
 * @param message The description shown for the response.
 */
public record ApiError(int code, String message) {

    @Override
    public String toString() {
        return code + " " + message;
    }
}
