package com.acme.furfolio.eventlog.telemetry;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicRecorderMetrics implements RecorderMetrics {
    private final LongAdder recorded = new LongAdder();
    private final LongAdder escalated = new LongAdder();
    private final LongAdder evicted = new LongAdder();
    private final LongAdder delivered = new LongAdder();
    private final LongAdder deliveryFailures = new LongAdder();
    private final LongAdder deliveryDropped = new LongAdder();
    private final AtomicInteger bufferDepth = new AtomicInteger();

    @Override
    public void incRecorded(long n) {
        recorded.add(Math.max(0L, n));
    }

    @Override
    public void incEscalated(long n) {
        escalated.add(Math.max(0L, n));
    }

    @Override
    public void incEvicted(long n) {
        evicted.add(Math.max(0L, n));
    }

    @Override
    public void incDelivered(long n) {
        delivered.add(Math.max(0L, n));
    }

    @Override
    public void incDeliveryFailures(long n) {
        deliveryFailures.add(Math.max(0L, n));
    }

    @Override
    public void incDeliveryDropped(long n) {
        deliveryDropped.add(Math.max(0L, n));
    }

    @Override
    public void setBufferDepth(int depth) {
        bufferDepth.set(Math.max(0, depth));
    }

    public Snapshot snapshot() {
        return new Snapshot(
            recorded.sum(),
            escalated.sum(),
            evicted.sum(),
            delivered.sum(),
            deliveryFailures.sum(),
            deliveryDropped.sum(),
            bufferDepth.get()
        );
    }

    public record Snapshot(long recorded,
                           long escalated,
                           long evicted,
                           long delivered,
                           long deliveryFailures,
                           long deliveryDropped,
                           int bufferDepth) {}
}
