package com.acme.furfolio.eventlog.diagnostics;

import com.acme.furfolio.eventlog.recorder.EventRecorder;
import com.acme.furfolio.eventlog.render.DiagnosticsRenderer;
import com.acme.furfolio.eventlog.telemetry.AtomicRecorderMetrics;
import com.acme.furfolio.eventlog.util.EventLogDefaults;
import com.acme.furfolio.eventlog.util.HttpStatusCodes;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.ToLongFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only HTTP view over a set of recorders.
 *
 * <p>{@code GET <path>/metrics} serves Prometheus text with one {@code component} label per
 * recorder. {@code GET <path>/events?component=<name>} serves the rendered trail of that
 * recorder, or a JSON array when {@code format=json} is given.</p>
 */
public final class DiagnosticsHttpEndpoint implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(DiagnosticsHttpEndpoint.class.getName());
    private static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    private static final String PROMETHEUS_TEXT = "text/plain; version=0.0.4; charset=utf-8";
    private static final String APPLICATION_JSON = "application/json; charset=utf-8";

    private final Map<String, EventRecorder> recorders;
    private final String path;
    private final HttpServer server;
    private final ExecutorService executor;

    public DiagnosticsHttpEndpoint(List<EventRecorder> recorders, int port, String path) throws IOException {
        Objects.requireNonNull(recorders, "recorders");
        Map<String, EventRecorder> byComponent = new LinkedHashMap<>();
        for (EventRecorder recorder : recorders) {
            byComponent.put(Objects.toString(recorder.componentName(), "-"), recorder);
        }
        this.recorders = Collections.unmodifiableMap(byComponent);
        this.path = normalizePath(path);
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.server.createContext(this.path + "/metrics", this::handleMetrics);
        this.server.createContext(this.path + "/events", this::handleEvents);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "eventlog-diagnostics-endpoint");
            t.setDaemon(true);
            return t;
        });
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        LOG.info("Event log diagnostics endpoint started on :" + port() + path);
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public String path() {
        return path;
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                write(exchange, HttpStatusCodes.METHOD_NOT_ALLOWED, TEXT_PLAIN, "method not allowed\n");
                return;
            }
            Map<String, AtomicRecorderMetrics.Snapshot> snapshots = new LinkedHashMap<>();
            for (Map.Entry<String, EventRecorder> e : recorders.entrySet()) {
                snapshots.put(e.getKey(), e.getValue().metrics());
            }
            write(exchange, HttpStatusCodes.OK, PROMETHEUS_TEXT, renderPrometheus(snapshots));
        } catch (Throwable t) {
            LOG.log(Level.WARNING, "Diagnostics metrics request failed", t);
            write(exchange, HttpStatusCodes.INTERNAL_ERROR, TEXT_PLAIN, "internal error\n");
        }
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                write(exchange, HttpStatusCodes.METHOD_NOT_ALLOWED, TEXT_PLAIN, "method not allowed\n");
                return;
            }
            Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
            EventRecorder recorder = recorders.get(query.getOrDefault("component", ""));
            if (recorder == null) {
                write(exchange, HttpStatusCodes.NOT_FOUND, TEXT_PLAIN, "unknown component\n");
                return;
            }
            if ("json".equalsIgnoreCase(query.get("format"))) {
                write(exchange, HttpStatusCodes.OK, APPLICATION_JSON, DiagnosticsRenderer.renderJson(recorder.snapshot()));
            } else {
                write(exchange, HttpStatusCodes.OK, TEXT_PLAIN, recorder.render());
            }
        } catch (Throwable t) {
            LOG.log(Level.WARNING, "Diagnostics events request failed", t);
            write(exchange, HttpStatusCodes.INTERNAL_ERROR, TEXT_PLAIN, "internal error\n");
        }
    }

    private static void write(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> out = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return out;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            out.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return out;
    }

    private static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isBlank() || "/".equals(rawPath.trim())) {
            return EventLogDefaults.DEFAULT_METRICS_HTTP_PATH;
        }
        String p = rawPath.trim();
        if (!p.startsWith("/")) {
            p = "/" + p;
        }
        return p.endsWith("/") ? p.substring(0, p.length() - 1) : p;
    }

    static String renderPrometheus(Map<String, AtomicRecorderMetrics.Snapshot> byComponent) {
        StringBuilder sb = new StringBuilder(EventLogDefaults.DEFAULT_METRICS_RENDER_BUFFER);
        appendFamily(sb, byComponent, "eventlog_events_recorded_total", "Events recorded", "counter",
            AtomicRecorderMetrics.Snapshot::recorded);
        appendFamily(sb, byComponent, "eventlog_events_escalated_total", "Events classified for escalation", "counter",
            AtomicRecorderMetrics.Snapshot::escalated);
        appendFamily(sb, byComponent, "eventlog_events_evicted_total", "Events evicted from the bounded buffer", "counter",
            AtomicRecorderMetrics.Snapshot::evicted);
        appendFamily(sb, byComponent, "eventlog_deliveries_total", "Events handed to the delivery sink successfully", "counter",
            AtomicRecorderMetrics.Snapshot::delivered);
        appendFamily(sb, byComponent, "eventlog_delivery_failures_total", "Delivery attempts that raised a failure", "counter",
            AtomicRecorderMetrics.Snapshot::deliveryFailures);
        appendFamily(sb, byComponent, "eventlog_delivery_dropped_total", "Deliveries dropped before reaching the sink", "counter",
            AtomicRecorderMetrics.Snapshot::deliveryDropped);
        appendFamily(sb, byComponent, "eventlog_buffer_depth", "Events currently buffered", "gauge",
            s -> (long) s.bufferDepth());
        return sb.toString();
    }

    private static void appendFamily(StringBuilder sb,
                                     Map<String, AtomicRecorderMetrics.Snapshot> byComponent,
                                     String metric,
                                     String help,
                                     String type,
                                     ToLongFunction<AtomicRecorderMetrics.Snapshot> value) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
        for (Map.Entry<String, AtomicRecorderMetrics.Snapshot> e : byComponent.entrySet()) {
            sb.append(metric)
                .append("{component=\"").append(escapeLabelValue(e.getKey())).append("\"} ")
                .append(value.applyAsLong(e.getValue()))
                .append('\n');
        }
    }

    private static String escapeLabelValue(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
