package com.github.dimitryivaniuta.labelbridge.credential;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A user or service identity. Never physically deleted; deactivation flips {@link #status}
 * so audit rows keep pointing at a real principal.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "principal")
public class Principal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Login identifier (e-mail), stored lower-cased. */
    @Column(name = "identifier", nullable = false, unique = true, length = 255)
    private String identifier;

    @Column(name = "display_name", nullable = false, length = 255)
    private String displayName;

    /**
     * Salted PBKDF2 hash, see {@link SecretHashService}. Never the raw secret.
     */
    @Column(name = "secret_hash", nullable = false, length = 255)
    private String secretHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    @Builder.Default
    private PrincipalStatus status = PrincipalStatus.ACTIVE;

    @Column(name = "platform_operator", nullable = false)
    private boolean platformOperator;

    /**
     * Bumped on logout, secret rotation and deactivation; access tokens carrying an older
     * generation are rejected.
     */
    @Column(name = "token_generation", nullable = false)
    private long tokenGeneration;

    @Column(name = "last_login_at")
    private Instant lastLoginAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status == PrincipalStatus.ACTIVE;
    }
}
