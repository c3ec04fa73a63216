package com.acme.furfolio.eventlog.audit;

/**
 * Destination for recorded events.
 *
 * <p>Implementations must be thread-safe and tolerate being called at high frequency.
 * {@code deliver} may block on I/O and may throw; the recorder contains any failure so
 * it never reaches the code that recorded the event.</p>
 */
public interface AnalyticsDelivery {
    void deliver(EventRecord record) throws Exception;
}
