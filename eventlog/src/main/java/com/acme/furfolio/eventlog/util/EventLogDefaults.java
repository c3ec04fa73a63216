package com.acme.furfolio.eventlog.util;

/**
 * Default capacity, timeout, and tuning constants for event recorders.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class EventLogDefaults {

    // ---- Buffer ----
    public static final int DEFAULT_BUFFER_CAPACITY = 20;
    public static final int MAX_BUFFER_CAPACITY = 100_000;

    // ---- Async delivery ----
    public static final int DEFAULT_DELIVERY_QUEUE_CAPACITY = 1024;
    public static final int MAX_DELIVERY_QUEUE_CAPACITY = 1_000_000;
    public static final long DELIVERY_POLL_INTERVAL_MS = 100L;
    public static final long DELIVERY_DRAIN_TIMEOUT_MS = 5_000L;

    // ---- HTTP delivery ----
    public static final int DEFAULT_MAX_INFLIGHT = 256;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_RESPONSE_TIMEOUT_MS = 5_000;
    public static final int HTTPS_DEFAULT_PORT = 443;
    public static final int HTTP_DEFAULT_PORT = 80;
    public static final int DEFAULT_HTTP_POOL_SIZE = 8;
    public static final int DEFAULT_HTTP_IO_THREADS = 2;
    public static final int HTTP_RESPONSE_LIMIT = 64 * 1024;

    // ---- Diagnostics endpoint ----
    public static final int DEFAULT_METRICS_HTTP_PORT = 9465;
    public static final String DEFAULT_METRICS_HTTP_PATH = "/eventlog";
    public static final int DEFAULT_METRICS_RENDER_BUFFER = 2048;

    private EventLogDefaults() {
    }
}
