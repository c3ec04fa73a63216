package com.acme.furfolio.eventlog.telemetry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AtomicRecorderMetricsTest {

    @Test
    void shouldAccumulateCountersAndKeepLatestDepth() {
        AtomicRecorderMetrics metrics = new AtomicRecorderMetrics();
        metrics.incRecorded(5);
        metrics.incRecorded(2);
        metrics.incEscalated(1);
        metrics.incEvicted(3);
        metrics.incDelivered(4);
        metrics.incDeliveryFailures(2);
        metrics.incDeliveryDropped(1);
        metrics.setBufferDepth(9);
        metrics.setBufferDepth(4);

        AtomicRecorderMetrics.Snapshot s = metrics.snapshot();

        assertEquals(7L, s.recorded());
        assertEquals(1L, s.escalated());
        assertEquals(3L, s.evicted());
        assertEquals(4L, s.delivered());
        assertEquals(2L, s.deliveryFailures());
        assertEquals(1L, s.deliveryDropped());
        assertEquals(4, s.bufferDepth());
    }
}
