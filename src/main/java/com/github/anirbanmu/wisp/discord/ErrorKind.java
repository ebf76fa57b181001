package com.github.anirbanmu.wisp.discord;

// classification of a non-2xx rest response
public enum ErrorKind {
    NOT_MODIFIED(304),
    BAD_REQUEST(400),
    UNAUTHORIZED(401),
    FORBIDDEN(403),
    NOT_FOUND(404),
    METHOD_NOT_ALLOWED(405),
    RATE_LIMITED(429),
    SERVER_ERROR(-1);

    private final int status;

    ErrorKind(int status) {
        this.status = status;
    }

    public static ErrorKind of(int status) {
        for (ErrorKind kind : values()) {
            if (kind.status == status) {
                return kind;
            }
        }
        return SERVER_ERROR;
    }

    // kinds that are handed straight back to the caller, no retry
    public boolean isClientError() {
        return this != RATE_LIMITED && this != SERVER_ERROR;
    }
}
