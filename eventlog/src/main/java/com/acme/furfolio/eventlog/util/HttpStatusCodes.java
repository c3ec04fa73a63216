package com.acme.furfolio.eventlog.util;

/**
 * HTTP status codes used by the diagnostics endpoint and the HTTP delivery sink.
 */
public final class HttpStatusCodes {

    // ---- Success ----
    public static final int OK = 200;
    public static final int MULTIPLE_CHOICES = 300;

    // ---- Client errors ----
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;

    // ---- Server errors ----
    public static final int INTERNAL_ERROR = 500;

    private HttpStatusCodes() {
    }

    public static boolean isSuccess(int status) {
        return status >= OK && status < MULTIPLE_CHOICES;
    }
}
