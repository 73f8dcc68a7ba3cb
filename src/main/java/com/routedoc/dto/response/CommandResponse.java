package com.routedoc.dto.response;

/**
 * The outcome of a shell command, printed green on success and red on failure.
 *
 * @param success Whether the command succeeded.
 * @param message The message shown to the user.
 */
public record CommandResponse(boolean success, String message) {

    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String RESET = "\u001B[0m";

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse failed(String message) {
        return new CommandResponse(false, message);
    }

    public String toAnsiString() {
        return (success ? GREEN : RED) + message + RESET;
    }
}
