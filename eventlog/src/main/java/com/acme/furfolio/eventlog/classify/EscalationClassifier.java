package com.acme.furfolio.eventlog.classify;

import java.util.Map;

/**
 * Decides whether an event is high-severity. Implementations must be pure and total.
 */
@FunctionalInterface
public interface EscalationClassifier {
    /**
     * @param name event name, may be {@code null}
     * @param metadata rendered metadata values, may be {@code null}
     */
    boolean classify(String name, Map<String, String> metadata);
}
