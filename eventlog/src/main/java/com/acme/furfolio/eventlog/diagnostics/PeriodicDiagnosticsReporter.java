package com.acme.furfolio.eventlog.diagnostics;

import com.acme.furfolio.eventlog.recorder.EventRecorder;
import com.acme.furfolio.eventlog.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Logs each recorder's diagnostics as one JSON line per interval.
 */
public final class PeriodicDiagnosticsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicDiagnosticsReporter.class.getName());

    private final List<EventRecorder> recorders;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicDiagnosticsReporter(List<EventRecorder> recorders, long intervalSeconds) {
        this.recorders = List.copyOf(Objects.requireNonNull(recorders, "recorders"));
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "eventlog-diagnostics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    void emit() {
        for (EventRecorder recorder : recorders) {
            try {
                LOG.info(renderLine(recorder));
            } catch (Throwable t) {
                LOG.warning("Diagnostics reporter failure: " + t.getClass().getSimpleName());
            }
        }
    }

    static String renderLine(EventRecorder recorder) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "eventlog_diagnostics");
        payload.putAll(recorder.diagnostics());
        try {
            return JsonCodec.writeString(payload);
        } catch (Exception e) {
            return payload.toString();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
