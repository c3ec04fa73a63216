package com.acme.furfolio.eventlog.context;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Identity and component values stamped onto every recorded event.
 *
 * <p>The session identity (role and staff id) lives in a holder shared by every context
 * created through {@link #forComponent(String)}, so one sign-in is seen by all components.
 * The component name is fixed per context instance.</p>
 *
 * <p>Identity changes replace the whole identity in one atomic swap. A concurrent
 * {@link #snapshot()} observes either the previous identity or the new one in full;
 * ordering between a sign-in and a concurrent record is not defined.</p>
 */
public final class AuditContext {
    private final AtomicReference<Identity> identity;
    private final String componentName;

    private AuditContext(AtomicReference<Identity> identity, String componentName) {
        this.identity = identity;
        this.componentName = componentName;
    }

    public static AuditContext create(String componentName) {
        return new AuditContext(new AtomicReference<>(Identity.SIGNED_OUT), componentName);
    }

    /**
     * Returns a context for another component that shares this context's session identity.
     */
    public AuditContext forComponent(String componentName) {
        return new AuditContext(identity, componentName);
    }

    public void signIn(String role, String staffId) {
        identity.set(new Identity(role, staffId));
    }

    public void signOut() {
        identity.set(Identity.SIGNED_OUT);
    }

    public String componentName() {
        return componentName;
    }

    public AuditSnapshot snapshot() {
        Identity current = identity.get();
        return new AuditSnapshot(current.role(), current.staffId(), componentName);
    }

    @Override
    public String toString() {
        Identity current = identity.get();
        return "AuditContext{component=" + componentName
            + ", role=" + Objects.toString(current.role(), "-")
            + ", staffId=" + Objects.toString(current.staffId(), "-") + '}';
    }

    private record Identity(String role, String staffId) {
        static final Identity SIGNED_OUT = new Identity(null, null);
    }
}
