package com.acme.furfolio.eventlog.recorder;

import com.acme.furfolio.eventlog.audit.AnalyticsDelivery;
import com.acme.furfolio.eventlog.audit.ConsoleAnalyticsDelivery;
import com.acme.furfolio.eventlog.audit.EventRecord;
import com.acme.furfolio.eventlog.audit.NoopAnalyticsDelivery;
import com.acme.furfolio.eventlog.classify.EscalationClassifier;
import com.acme.furfolio.eventlog.classify.KeywordEscalationClassifier;
import com.acme.furfolio.eventlog.context.AuditContext;
import com.acme.furfolio.eventlog.context.AuditSnapshot;
import com.acme.furfolio.eventlog.queue.AppendResult;
import com.acme.furfolio.eventlog.queue.BoundedEventBuffer;
import com.acme.furfolio.eventlog.render.DiagnosticsRenderer;
import com.acme.furfolio.eventlog.telemetry.AtomicRecorderMetrics;
import com.acme.furfolio.eventlog.util.EventLogDefaults;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Records events into a bounded audit trail and forwards each one to a delivery sink.
 *
 * <p>Per call: classify, snapshot the audit context, then under the record lock assign
 * sequence and timestamp and append to the buffer. Delivery runs after the lock is
 * released, inline or on the async worker depending on {@link DeliveryMode}. The buffer
 * append is visible to {@link #snapshot()} as soon as {@link #record} returns, whatever
 * the delivery outcome.</p>
 *
 * <p>One instance per engine; instances share nothing except the session identity of
 * their {@link AuditContext}.</p>
 */
public final class EventRecorder implements AutoCloseable {
    private final BoundedEventBuffer<EventRecord> buffer;
    private final AnalyticsDelivery delivery;
    private final AuditContext auditContext;
    private final EscalationClassifier classifier;
    private final DeliveryDispatcher dispatcher;
    private final AtomicRecorderMetrics metrics;
    private final Clock clock;
    private final ReentrantLock recordLock = new ReentrantLock();

    // guarded by recordLock, together with the buffer-depth gauge
    private long nextSequence = 1L;
    private Instant lastTimestamp = Instant.EPOCH;

    private EventRecorder(Builder b) {
        this.buffer = new BoundedEventBuffer<>(b.capacity);
        this.delivery = b.delivery;
        this.auditContext = b.auditContext;
        this.classifier = b.classifier;
        this.metrics = b.metrics;
        this.clock = b.clock;
        GuardedDelivery guarded = new GuardedDelivery(b.delivery, metrics, auditContext.componentName());
        this.dispatcher = b.deliveryMode == DeliveryMode.ASYNC
            ? new AsyncDeliveryDispatcher(guarded, metrics, b.deliveryQueueCapacity, auditContext.componentName())
            : new InlineDeliveryDispatcher(guarded);
    }

    public static Builder builder(AuditContext auditContext) {
        return new Builder(auditContext);
    }

    public EventRecord record(String name) {
        return record(name, null);
    }

    /**
     * Records one event. Never throws because of the delivery sink; null or empty names
     * are accepted as given.
     *
     * @param metadata values are rendered with {@link String#valueOf(Object)}; may be {@code null}
     */
    public EventRecord record(String name, Map<String, ?> metadata) {
        Map<String, String> rendered = renderMetadata(metadata);
        boolean escalate = classifier.classify(name, rendered);
        AuditSnapshot audit = auditContext.snapshot();
        String id = UUID.randomUUID().toString();

        EventRecord record;
        AppendResult<EventRecord> appended;
        recordLock.lock();
        try {
            Instant now = clock.instant();
            if (now.isBefore(lastTimestamp)) {
                now = lastTimestamp;
            }
            lastTimestamp = now;
            record = new EventRecord(
                id,
                nextSequence++,
                now,
                name,
                rendered,
                audit.role(),
                audit.staffId(),
                audit.componentName(),
                escalate
            );
            appended = buffer.append(record);
            metrics.setBufferDepth(appended.depth());
        } finally {
            recordLock.unlock();
        }

        metrics.incRecorded(1L);
        if (escalate) {
            metrics.incEscalated(1L);
        }
        if (appended instanceof AppendResult.Evicted) {
            metrics.incEvicted(1L);
        }

        dispatcher.dispatch(record);
        return record;
    }

    /**
     * Oldest-first copy of the buffered events; later records do not change it.
     */
    public List<EventRecord> snapshot() {
        return buffer.snapshot();
    }

    public String render() {
        return DiagnosticsRenderer.render(snapshot());
    }

    public void clear() {
        recordLock.lock();
        try {
            buffer.clear();
            metrics.setBufferDepth(0);
        } finally {
            recordLock.unlock();
        }
    }

    public String componentName() {
        return auditContext.componentName();
    }

    public int capacity() {
        return buffer.capacity();
    }

    public DeliveryMode deliveryMode() {
        return dispatcher.mode();
    }

    public int pendingDeliveries() {
        return dispatcher.pending();
    }

    public AtomicRecorderMetrics.Snapshot metrics() {
        return metrics.snapshot();
    }

    public Map<String, String> diagnostics() {
        List<EventRecord> events = snapshot();
        long escalatedInBuffer = events.stream().filter(EventRecord::escalate).count();
        AtomicRecorderMetrics.Snapshot m = metrics.snapshot();

        Map<String, String> out = new LinkedHashMap<>();
        out.put("component", Objects.toString(componentName(), "-"));
        out.put("capacity", Integer.toString(buffer.capacity()));
        out.put("bufferedEvents", Integer.toString(events.size()));
        out.put("escalatedInBuffer", Long.toString(escalatedInBuffer));
        out.put("recordedTotal", Long.toString(m.recorded()));
        out.put("evictedTotal", Long.toString(m.evicted()));
        out.put("deliveredTotal", Long.toString(m.delivered()));
        out.put("deliveryFailures", Long.toString(m.deliveryFailures()));
        out.put("deliveryDropped", Long.toString(m.deliveryDropped()));
        out.put("deliveryMode", dispatcher.mode().name());
        if (delivery instanceof ConsoleAnalyticsDelivery console) {
            out.put("verbose", Boolean.toString(console.verbose()));
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public void close() {
        dispatcher.close();
    }

    private static Map<String, String> renderMetadata(Map<String, ?> metadata) {
        if (metadata == null) {
            return null;
        }
        Map<String, String> copy = new LinkedHashMap<>(Math.max(4, metadata.size() * 2));
        for (Map.Entry<String, ?> e : metadata.entrySet()) {
            copy.put(String.valueOf(e.getKey()), String.valueOf(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder {
        private final AuditContext auditContext;
        private int capacity = EventLogDefaults.DEFAULT_BUFFER_CAPACITY;
        private AnalyticsDelivery delivery = NoopAnalyticsDelivery.INSTANCE;
        private DeliveryMode deliveryMode = DeliveryMode.INLINE;
        private int deliveryQueueCapacity = EventLogDefaults.DEFAULT_DELIVERY_QUEUE_CAPACITY;
        private EscalationClassifier classifier = KeywordEscalationClassifier.INSTANCE;
        private AtomicRecorderMetrics metrics;
        private Clock clock = Clock.systemUTC();

        private Builder(AuditContext auditContext) {
            this.auditContext = Objects.requireNonNull(auditContext, "auditContext");
        }

        public Builder capacity(int capacity) {
            if (capacity < 1) {
                throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
            }
            this.capacity = capacity;
            return this;
        }

        public Builder delivery(AnalyticsDelivery delivery) {
            this.delivery = Objects.requireNonNull(delivery, "delivery");
            return this;
        }

        public Builder deliveryMode(DeliveryMode deliveryMode) {
            this.deliveryMode = Objects.requireNonNull(deliveryMode, "deliveryMode");
            return this;
        }

        public Builder deliveryQueueCapacity(int deliveryQueueCapacity) {
            this.deliveryQueueCapacity = Math.max(1, deliveryQueueCapacity);
            return this;
        }

        public Builder classifier(EscalationClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier");
            return this;
        }

        public Builder metrics(AtomicRecorderMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder config(EventRecorderConfig config) {
            Objects.requireNonNull(config, "config");
            return capacity(config.bufferCapacity())
                .deliveryMode(config.deliveryMode())
                .deliveryQueueCapacity(config.deliveryQueueCapacity());
        }

        public EventRecorder build() {
            if (metrics == null) {
                metrics = new AtomicRecorderMetrics();
            }
            return new EventRecorder(this);
        }
    }
}
