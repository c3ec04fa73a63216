package com.acme.furfolio.eventlog.telemetry;

public interface RecorderMetrics {
    void incRecorded(long n);
    void incEscalated(long n);
    void incEvicted(long n);
    void incDelivered(long n);
    void incDeliveryFailures(long n);
    void incDeliveryDropped(long n);
    void setBufferDepth(int depth);
}
