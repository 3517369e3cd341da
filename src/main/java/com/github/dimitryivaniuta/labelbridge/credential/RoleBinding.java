package com.github.dimitryivaniuta.labelbridge.credential;

import com.github.dimitryivaniuta.labelbridge.authz.Role;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Binds a principal to a role inside one organization. A non-null {@link #projectId}
 * narrows the binding to that project.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "role_binding", indexes = {
        @Index(name = "ix_role_binding_principal", columnList = "principal_id"),
        @Index(name = "ix_role_binding_org", columnList = "organization_id")
})
public class RoleBinding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "principal_id", nullable = false)
    private Long principalId;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "project_id")
    private Long projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private Role role;

    @Column(name = "assigned_by")
    private Long assignedBy;

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

    public RoleGrant toGrant() {
        return new RoleGrant(organizationId, projectId, role);
    }
}
