package com.acme.furfolio.eventlog.recorder;

import com.acme.furfolio.eventlog.util.EnvVars;
import com.acme.furfolio.eventlog.util.EventLogDefaults;
import com.acme.furfolio.eventlog.util.EventLogEnvKeys;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Immutable runtime settings for recorders, sinks and the diagnostics surfaces.
 *
 * <p>{@code httpDeliveryUrl} is {@code null} when remote delivery is disabled.
 * {@code metricsLogIntervalSec} of zero disables the periodic reporter.</p>
 */
public record EventRecorderConfig(
    int bufferCapacity,
    DeliveryMode deliveryMode,
    int deliveryQueueCapacity,
    boolean verbose,
    URI httpDeliveryUrl,
    Map<String, String> httpHeaders,
    int httpTimeoutMs,
    boolean metricsHttpEnabled,
    int metricsHttpPort,
    String metricsHttpPath,
    long metricsLogIntervalSec
) {
    private static final Logger LOG = Logger.getLogger(EventRecorderConfig.class.getName());

    public EventRecorderConfig {
        if (bufferCapacity < 1) {
            throw new IllegalArgumentException("bufferCapacity must be >= 1, got " + bufferCapacity);
        }
        deliveryMode = deliveryMode == null ? DeliveryMode.ASYNC : deliveryMode;
        deliveryQueueCapacity = Math.max(1, deliveryQueueCapacity);
        httpHeaders = Map.copyOf(httpHeaders == null ? Map.of() : httpHeaders);
        httpTimeoutMs = Math.max(1, httpTimeoutMs);
        metricsHttpPath = metricsHttpPath == null || metricsHttpPath.isBlank()
            ? EventLogDefaults.DEFAULT_METRICS_HTTP_PATH
            : metricsHttpPath;
        metricsLogIntervalSec = Math.max(0L, metricsLogIntervalSec);
    }

    public static EventRecorderConfig defaults() {
        return fromEnv(Map.of());
    }

    public static EventRecorderConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static EventRecorderConfig fromEnv(Map<String, String> env) {
        int capacity = EnvVars.getIntClamped(env, EventLogEnvKeys.EVENTLOG_BUFFER_CAPACITY,
            EventLogDefaults.DEFAULT_BUFFER_CAPACITY, 1, EventLogDefaults.MAX_BUFFER_CAPACITY);
        DeliveryMode mode = EnvVars.getEnum(env, EventLogEnvKeys.EVENTLOG_DELIVERY_MODE,
            DeliveryMode.class, DeliveryMode.ASYNC);
        int queueCapacity = EnvVars.getIntClamped(env, EventLogEnvKeys.EVENTLOG_DELIVERY_QUEUE_CAPACITY,
            EventLogDefaults.DEFAULT_DELIVERY_QUEUE_CAPACITY, 1, EventLogDefaults.MAX_DELIVERY_QUEUE_CAPACITY);
        boolean verbose = EnvVars.getBoolean(env, EventLogEnvKeys.EVENTLOG_VERBOSE, false);

        URI httpUrl = parseUri(EnvVars.getOrDefault(env, EventLogEnvKeys.EVENTLOG_HTTP_DELIVERY_URL, null));
        Map<String, String> headers = new LinkedHashMap<>();
        String authHeader = EnvVars.getOrDefault(env, EventLogEnvKeys.EVENTLOG_HTTP_AUTH_HEADER, null);
        String authValue = EnvVars.getOrDefault(env, EventLogEnvKeys.EVENTLOG_HTTP_AUTH_VALUE, null);
        if (authHeader != null && authValue != null) {
            headers.put(authHeader, authValue);
        }
        int httpTimeout = EnvVars.getIntClamped(env, EventLogEnvKeys.EVENTLOG_HTTP_TIMEOUT_MS,
            EventLogDefaults.DEFAULT_RESPONSE_TIMEOUT_MS, 1, 600_000);

        boolean metricsHttp = EnvVars.getBoolean(env, EventLogEnvKeys.EVENTLOG_METRICS_HTTP_ENABLED, false);
        int metricsPort = EnvVars.getIntClamped(env, EventLogEnvKeys.EVENTLOG_METRICS_HTTP_PORT,
            EventLogDefaults.DEFAULT_METRICS_HTTP_PORT, 0, 65_535);
        String metricsPath = EnvVars.getOrDefault(env, EventLogEnvKeys.EVENTLOG_METRICS_HTTP_PATH,
            EventLogDefaults.DEFAULT_METRICS_HTTP_PATH);
        long logInterval = EnvVars.getLongClamped(env, EventLogEnvKeys.EVENTLOG_METRICS_LOG_INTERVAL_SEC,
            0L, 0L, 86_400L);

        return new EventRecorderConfig(
            capacity,
            mode,
            queueCapacity,
            verbose,
            httpUrl,
            headers,
            httpTimeout,
            metricsHttp,
            metricsPort,
            metricsPath,
            logInterval
        );
    }

    private static URI parseUri(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            URI uri = URI.create(raw);
            if (uri.getHost() == null) {
                LOG.warning("Ignoring " + EventLogEnvKeys.EVENTLOG_HTTP_DELIVERY_URL + " without host: " + raw);
                return null;
            }
            return uri;
        } catch (IllegalArgumentException e) {
            LOG.warning("Ignoring malformed " + EventLogEnvKeys.EVENTLOG_HTTP_DELIVERY_URL + ": " + e.getMessage());
            return null;
        }
    }
}
