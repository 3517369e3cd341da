package com.github.dimitryivaniuta.labelbridge.audit;

import java.util.Objects;

/**
 * Input to {@link AuditLog#record(AuditEvent)}. Request context (correlation id, client ip)
 * is attached by the log itself from the calling thread's MDC.
 *
 * @param actorId     principal id, or {@link #ANONYMOUS}
 * @param kind        what happened
 * @param resourceRef free-form resource reference, e.g. {@code org:1/project:7}
 * @param outcome     allow / deny / error
 * @param reason      short machine-readable reason, may be null
 */
public record AuditEvent(
        String actorId,
        AuditEventKind kind,
        String resourceRef,
        AuditOutcome outcome,
        String reason
) {

    public static final String ANONYMOUS = "anonymous";

    public AuditEvent {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        actorId = (actorId == null || actorId.isBlank()) ? ANONYMOUS : actorId;
    }

    public static AuditEvent allow(Long actorId, AuditEventKind kind, String resourceRef) {
        return new AuditEvent(actorRef(actorId), kind, resourceRef, AuditOutcome.ALLOW, null);
    }

    public static AuditEvent deny(Long actorId, AuditEventKind kind, String resourceRef, String reason) {
        return new AuditEvent(actorRef(actorId), kind, resourceRef, AuditOutcome.DENY, reason);
    }

    public static AuditEvent error(Long actorId, AuditEventKind kind, String resourceRef, String reason) {
        return new AuditEvent(actorRef(actorId), kind, resourceRef, AuditOutcome.ERROR, reason);
    }

    private static String actorRef(Long actorId) {
        return actorId == null ? ANONYMOUS : actorId.toString();
    }
}
