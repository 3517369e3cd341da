package com.github.dimitryivaniuta.labelbridge.audit;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Append-only audit row. Never updated or deleted by the application; retention is handled
 * outside of it.
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Immutable
@Entity
@Table(name = "audit_record", indexes = {
        @Index(name = "ix_audit_record_actor", columnList = "actor_id"),
        @Index(name = "ix_audit_record_created", columnList = "created_at")
})
public class AuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "actor_id", nullable = false, length = 64, updatable = false)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_kind", nullable = false, length = 32, updatable = false)
    private AuditEventKind eventKind;

    @Column(name = "resource_ref", length = 255, updatable = false)
    private String resourceRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 16, updatable = false)
    private AuditOutcome outcome;

    @Column(name = "reason", length = 255, updatable = false)
    private String reason;

    @Column(name = "correlation_id", length = 64, updatable = false)
    private String correlationId;

    @Column(name = "client_ip", length = 64, updatable = false)
    private String clientIp;

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
