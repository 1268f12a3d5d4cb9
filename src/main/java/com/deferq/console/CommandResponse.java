package com.deferq.console;

/**
 * Result of an operator command: an HTTP-like status code and plain text.
 */
public record CommandResponse(int status, String text) {

    public static CommandResponse ok(String text) {
        return new CommandResponse(200, text);
    }

    public static CommandResponse notFound(long id) {
        return new CommandResponse(404, "Job " + id + " does not exist.");
    }

    public boolean isOk() {
        return status == 200;
    }
}
