package com.github.anirbanmu.wisp.discord;

public class HttpException extends RuntimeException {
    private final ErrorKind kind;
    private final int status;
    private final String route;

    public HttpException(ErrorKind kind, int status, String route, String message) {
        super(message);
        this.kind = kind;
        this.status = status;
        this.route = route;
    }

    public HttpException(ErrorKind kind, int status, String route, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
        this.route = route;
    }

    public static HttpException forStatus(int status, String method, String route, String body) {
        ErrorKind kind = ErrorKind.of(status);
        String message = method + " " + route + " failed with " + status + " " + kind;
        if (body != null && !body.isBlank()) {
            message += ": " + body;
        }
        return new HttpException(kind, status, route, message);
    }

    public static HttpException retriesExhausted(String route, Throwable lastFailure) {
        return new HttpException(ErrorKind.SERVER_ERROR, -1, route,
            "Maximum amount of retries for `" + route + "`.", lastFailure);
    }

    public ErrorKind kind() {
        return kind;
    }

    // -1 when no response was received
    public int status() {
        return status;
    }

    public String route() {
        return route;
    }
}
