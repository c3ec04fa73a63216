package com.acme.furfolio.eventlog;

import com.acme.furfolio.eventlog.audit.AnalyticsDelivery;
import com.acme.furfolio.eventlog.audit.ConsoleAnalyticsDelivery;
import com.acme.furfolio.eventlog.context.AuditContext;
import com.acme.furfolio.eventlog.diagnostics.DiagnosticsHttpEndpoint;
import com.acme.furfolio.eventlog.diagnostics.PeriodicDiagnosticsReporter;
import com.acme.furfolio.eventlog.recorder.EventRecorder;
import com.acme.furfolio.eventlog.recorder.EventRecorderConfig;
import com.acme.furfolio.eventlog.transport.HttpAnalyticsDelivery;
import com.acme.furfolio.eventlog.util.EventLogDefaults;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds one recorder per component from an {@link EventRecorderConfig}, plus the shared
 * sink and the optional diagnostics endpoint and reporter, and closes them together.
 *
 * <p>Every recorder gets a context from {@link AuditContext#forComponent(String)} on the
 * session context, so they all see the same sign-in.</p>
 */
public final class EventLogRuntime implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(EventLogRuntime.class.getName());

    private final Map<String, EventRecorder> recorders;
    private final AnalyticsDelivery delivery;
    private final boolean ownsDelivery;
    private final DiagnosticsHttpEndpoint endpoint;
    private final PeriodicDiagnosticsReporter reporter;

    private EventLogRuntime(Map<String, EventRecorder> recorders,
                            AnalyticsDelivery delivery,
                            boolean ownsDelivery,
                            DiagnosticsHttpEndpoint endpoint,
                            PeriodicDiagnosticsReporter reporter) {
        this.recorders = recorders;
        this.delivery = delivery;
        this.ownsDelivery = ownsDelivery;
        this.endpoint = endpoint;
        this.reporter = reporter;
    }

    public static EventLogRuntime start(EventRecorderConfig config,
                                        AuditContext session,
                                        List<String> components) throws IOException {
        AnalyticsDelivery delivery = deliveryFor(config);
        try {
            return start(config, session, components, delivery, true);
        } catch (IOException | RuntimeException e) {
            closeQuietly(delivery);
            throw e;
        }
    }

    public static EventLogRuntime start(EventRecorderConfig config,
                                        AuditContext session,
                                        List<String> components,
                                        AnalyticsDelivery delivery) throws IOException {
        return start(config, session, components, delivery, false);
    }

    private static EventLogRuntime start(EventRecorderConfig config,
                                         AuditContext session,
                                         List<String> components,
                                         AnalyticsDelivery delivery,
                                         boolean ownsDelivery) throws IOException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(components, "components");
        Objects.requireNonNull(delivery, "delivery");

        Map<String, EventRecorder> recorders = new LinkedHashMap<>();
        for (String component : components) {
            if (recorders.containsKey(component)) {
                continue;
            }
            recorders.put(component, EventRecorder.builder(session.forComponent(component))
                .config(config)
                .delivery(delivery)
                .build());
        }
        List<EventRecorder> all = List.copyOf(recorders.values());

        DiagnosticsHttpEndpoint endpoint = null;
        PeriodicDiagnosticsReporter reporter = null;
        try {
            if (config.metricsHttpEnabled()) {
                endpoint = new DiagnosticsHttpEndpoint(all, config.metricsHttpPort(), config.metricsHttpPath());
                endpoint.start();
            }
            if (config.metricsLogIntervalSec() > 0L) {
                reporter = new PeriodicDiagnosticsReporter(all, config.metricsLogIntervalSec());
                reporter.start();
            }
        } catch (IOException | RuntimeException e) {
            closeAll(all, endpoint, reporter);
            throw e;
        }
        LOG.info("Event log runtime started components=" + recorders.keySet()
            + " mode=" + config.deliveryMode() + " capacity=" + config.bufferCapacity());
        return new EventLogRuntime(Collections.unmodifiableMap(recorders), delivery, ownsDelivery, endpoint, reporter);
    }

    /**
     * HTTP sink when a delivery URL is configured, otherwise the console sink.
     */
    public static AnalyticsDelivery deliveryFor(EventRecorderConfig config) {
        if (config.httpDeliveryUrl() != null) {
            return new HttpAnalyticsDelivery(
                config.httpDeliveryUrl(),
                config.httpHeaders(),
                EventLogDefaults.DEFAULT_MAX_INFLIGHT,
                config.httpTimeoutMs()
            );
        }
        return new ConsoleAnalyticsDelivery(config.verbose());
    }

    public EventRecorder recorder(String component) {
        EventRecorder recorder = recorders.get(component);
        if (recorder == null) {
            throw new IllegalArgumentException("no recorder for component " + component);
        }
        return recorder;
    }

    public List<EventRecorder> recorders() {
        return new ArrayList<>(recorders.values());
    }

    public AnalyticsDelivery delivery() {
        return delivery;
    }

    /** Bound port of the diagnostics endpoint, or -1 when it is disabled. */
    public int diagnosticsPort() {
        return endpoint == null ? -1 : endpoint.port();
    }

    @Override
    public void close() {
        closeAll(recorders.values(), endpoint, reporter);
        if (ownsDelivery) {
            closeQuietly(delivery);
        }
    }

    /**
     * Stops the reporter and endpoint, when present, then every recorder.
     */
    static void closeAll(Collection<EventRecorder> recorders,
                         DiagnosticsHttpEndpoint endpoint,
                         PeriodicDiagnosticsReporter reporter) {
        if (reporter != null) {
            reporter.close();
        }
        if (endpoint != null) {
            endpoint.close();
        }
        for (EventRecorder recorder : recorders) {
            recorder.close();
        }
    }

    private static void closeQuietly(AnalyticsDelivery delivery) {
        if (delivery instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close analytics delivery", e);
            }
        }
    }
}
