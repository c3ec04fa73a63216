package com.acme.furfolio.eventlog.util;

/**
 * Canonical environment variable names read by the event log runtime.
 */
public final class EventLogEnvKeys {
    public static final String EVENTLOG_BUFFER_CAPACITY = "EVENTLOG_BUFFER_CAPACITY";
    public static final String EVENTLOG_DELIVERY_MODE = "EVENTLOG_DELIVERY_MODE";
    public static final String EVENTLOG_DELIVERY_QUEUE_CAPACITY = "EVENTLOG_DELIVERY_QUEUE_CAPACITY";
    public static final String EVENTLOG_VERBOSE = "EVENTLOG_VERBOSE";

    public static final String EVENTLOG_HTTP_DELIVERY_URL = "EVENTLOG_HTTP_DELIVERY_URL";
    public static final String EVENTLOG_HTTP_AUTH_HEADER = "EVENTLOG_HTTP_AUTH_HEADER";
    public static final String EVENTLOG_HTTP_AUTH_VALUE = "EVENTLOG_HTTP_AUTH_VALUE";
    public static final String EVENTLOG_HTTP_TIMEOUT_MS = "EVENTLOG_HTTP_TIMEOUT_MS";

    public static final String EVENTLOG_METRICS_HTTP_ENABLED = "EVENTLOG_METRICS_HTTP_ENABLED";
    public static final String EVENTLOG_METRICS_HTTP_PORT = "EVENTLOG_METRICS_HTTP_PORT";
    public static final String EVENTLOG_METRICS_HTTP_PATH = "EVENTLOG_METRICS_HTTP_PATH";
    public static final String EVENTLOG_METRICS_LOG_INTERVAL_SEC = "EVENTLOG_METRICS_LOG_INTERVAL_SEC";

    private EventLogEnvKeys() {
    }
}
