package com.acme.furfolio.eventlog.audit;

public final class NoopAnalyticsDelivery implements AnalyticsDelivery {
    public static final NoopAnalyticsDelivery INSTANCE = new NoopAnalyticsDelivery();

    private NoopAnalyticsDelivery() {
    }

    @Override
    public void deliver(EventRecord record) {
    }
}
