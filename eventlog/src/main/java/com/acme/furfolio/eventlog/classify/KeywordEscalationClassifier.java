package com.acme.furfolio.eventlog.classify;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Escalates when the event name or any metadata value contains one of the
 * keywords {@code danger}, {@code critical} or {@code delete}, ignoring case.
 *
 * <p>Matching is plain substring containment; metadata keys are not inspected.</p>
 */
public final class KeywordEscalationClassifier implements EscalationClassifier {
    public static final KeywordEscalationClassifier INSTANCE = new KeywordEscalationClassifier();

    static final List<String> KEYWORDS = List.of("danger", "critical", "delete");

    private KeywordEscalationClassifier() {
    }

    @Override
    public boolean classify(String name, Map<String, String> metadata) {
        if (containsKeyword(name)) {
            return true;
        }
        if (metadata == null) {
            return false;
        }
        for (String value : metadata.values()) {
            if (containsKeyword(value)) {
                return true;
            }
        }
        return false;
    }

    static boolean containsKeyword(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
