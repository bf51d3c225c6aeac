package io.github.byzatic.pushscheduler.facade;

/**
 * Client-facing failure classes, each with the HTTP status a transport layer should answer with.
 */
public enum ErrorCategory {
    INVALID_REQUEST(400),
    MISSING_OFFSET(400),
    NOT_IN_FUTURE(400),
    NOT_FOUND(404),
    ALREADY_TERMINAL(409),
    UNAVAILABLE(503);

    private final int httpStatus;

    ErrorCategory(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
