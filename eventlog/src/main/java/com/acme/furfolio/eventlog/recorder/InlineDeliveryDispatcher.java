package com.acme.furfolio.eventlog.recorder;

import com.acme.furfolio.eventlog.audit.EventRecord;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

final class InlineDeliveryDispatcher implements DeliveryDispatcher {
    private final GuardedDelivery delivery;
    private final AtomicInteger inFlight = new AtomicInteger();

    InlineDeliveryDispatcher(GuardedDelivery delivery) {
        this.delivery = Objects.requireNonNull(delivery, "delivery");
    }

    @Override
    public DeliveryMode mode() {
        return DeliveryMode.INLINE;
    }

    @Override
    public void dispatch(EventRecord record) {
        inFlight.incrementAndGet();
        try {
            delivery.deliver(record);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public int pending() {
        return inFlight.get();
    }

    @Override
    public void close() {
    }
}
