package com.acme.furfolio.eventlog.recorder;

import com.acme.furfolio.eventlog.audit.EventRecord;
import com.acme.furfolio.eventlog.telemetry.RecorderMetrics;
import com.acme.furfolio.eventlog.util.EventLogDefaults;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Bounded queue drained by one daemon worker, so a recorder's events reach the sink
 * one at a time in recording order.
 *
 * <p>When the queue is full the oldest pending delivery is dropped. On close the worker
 * drains what it can within the drain timeout; anything left is abandoned and counted
 * as dropped. Every dispatched record is either handed to the sink or counted as dropped.</p>
 */
final class AsyncDeliveryDispatcher implements DeliveryDispatcher {
    private static final Logger LOG = Logger.getLogger(AsyncDeliveryDispatcher.class.getName());

    private final GuardedDelivery delivery;
    private final RecorderMetrics metrics;
    private final BlockingQueue<EventRecord> queue;
    private final long drainTimeoutMs;
    // dispatch and close agree on running under this lock, so no offer lands after close
    private final ReentrantLock stateLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Thread worker;

    AsyncDeliveryDispatcher(GuardedDelivery delivery,
                            RecorderMetrics metrics,
                            int queueCapacity,
                            String component) {
        this(delivery, metrics, queueCapacity, EventLogDefaults.DELIVERY_DRAIN_TIMEOUT_MS, component);
    }

    AsyncDeliveryDispatcher(GuardedDelivery delivery,
                            RecorderMetrics metrics,
                            int queueCapacity,
                            long drainTimeoutMs,
                            String component) {
        this.delivery = Objects.requireNonNull(delivery, "delivery");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.drainTimeoutMs = Math.max(0L, drainTimeoutMs);
        this.worker = new Thread(this::deliveryLoop, "eventlog-delivery-" + (component == null ? "default" : component));
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public DeliveryMode mode() {
        return DeliveryMode.ASYNC;
    }

    @Override
    public void dispatch(EventRecord record) {
        if (record == null) {
            return;
        }
        stateLock.lock();
        try {
            if (!running.get()) {
                metrics.incDeliveryDropped(1L);
                return;
            }
            if (queue.offer(record)) {
                return;
            }
            if (queue.poll() != null) {
                metrics.incDeliveryDropped(1L);
            }
            if (!queue.offer(record)) {
                metrics.incDeliveryDropped(1L);
            }
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public int pending() {
        return queue.size() + inFlight.get();
    }

    private void deliveryLoop() {
        try {
            while (running.get() || !queue.isEmpty()) {
                EventRecord record = queue.poll(EventLogDefaults.DELIVERY_POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (record == null) {
                    continue;
                }
                inFlight.incrementAndGet();
                try {
                    delivery.deliver(record);
                } finally {
                    inFlight.decrementAndGet();
                }
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stateLock.lock();
        try {
            if (!running.compareAndSet(true, false)) {
                return;
            }
        } finally {
            stateLock.unlock();
        }
        try {
            if (drainTimeoutMs > 0L) {
                worker.join(drainTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            worker.interrupt();
        }
        List<EventRecord> rest = new ArrayList<>();
        queue.drainTo(rest);
        int abandoned = rest.size();
        if (abandoned > 0) {
            metrics.incDeliveryDropped(abandoned);
            LOG.warning("Abandoned " + abandoned + " pending event deliveries on close");
        }
    }
}
