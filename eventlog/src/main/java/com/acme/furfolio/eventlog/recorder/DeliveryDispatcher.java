package com.acme.furfolio.eventlog.recorder;

import com.acme.furfolio.eventlog.audit.EventRecord;

/**
 * Hands recorded events to an {@link com.acme.furfolio.eventlog.audit.AnalyticsDelivery}.
 * Never throws from {@link #dispatch(EventRecord)}.
 */
interface DeliveryDispatcher extends AutoCloseable {
    DeliveryMode mode();

    void dispatch(EventRecord record);

    /** Records queued or being delivered right now. */
    int pending();

    @Override
    void close();
}
