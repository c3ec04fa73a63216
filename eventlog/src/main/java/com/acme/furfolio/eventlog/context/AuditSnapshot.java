package com.acme.furfolio.eventlog.context;

/**
 * Point-in-time copy of the audit identity. Any field may be {@code null}.
 */
public record AuditSnapshot(String role, String staffId, String componentName) {
}
