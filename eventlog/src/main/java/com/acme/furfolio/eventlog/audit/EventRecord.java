package com.acme.furfolio.eventlog.audit;

import java.time.Instant;
import java.util.Map;

/**
 * One recorded occurrence with the audit identity captured at record time.
 *
 * <p>{@code metadata} is {@code null} when the caller supplied none; otherwise it is an
 * unmodifiable, insertion-ordered map of rendered values. {@code role}, {@code staffId}
 * and {@code context} may be {@code null}.</p>
 */
public record EventRecord(
    String id,
    long sequence,
    Instant timestamp,
    String name,
    Map<String, String> metadata,
    String role,
    String staffId,
    String context,
    boolean escalate
) {
}
