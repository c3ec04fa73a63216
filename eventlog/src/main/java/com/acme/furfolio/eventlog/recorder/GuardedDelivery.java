package com.acme.furfolio.eventlog.recorder;

import com.acme.furfolio.eventlog.audit.AnalyticsDelivery;
import com.acme.furfolio.eventlog.audit.EventRecord;
import com.acme.furfolio.eventlog.telemetry.RecorderMetrics;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Invokes the sink and contains every failure it raises.
 */
final class GuardedDelivery {
    private static final Logger LOG = Logger.getLogger(GuardedDelivery.class.getName());

    private final AnalyticsDelivery delivery;
    private final RecorderMetrics metrics;
    private final String component;

    GuardedDelivery(AnalyticsDelivery delivery, RecorderMetrics metrics, String component) {
        this.delivery = Objects.requireNonNull(delivery, "delivery");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.component = component;
    }

    boolean deliver(EventRecord record) {
        try {
            delivery.deliver(record);
            metrics.incDelivered(1L);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.incDeliveryFailures(1L);
            LOG.warning("Event delivery interrupted component=" + component + " seq=" + record.sequence());
            return false;
        } catch (Throwable t) {
            metrics.incDeliveryFailures(1L);
            LOG.log(Level.WARNING, "Event delivery failed component=" + component
                + " seq=" + record.sequence() + " name=" + record.name(), t);
            return false;
        }
    }
}
