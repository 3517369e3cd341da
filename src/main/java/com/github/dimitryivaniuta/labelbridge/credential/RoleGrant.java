package com.github.dimitryivaniuta.labelbridge.credential;

import com.github.dimitryivaniuta.labelbridge.authz.Role;

import java.util.Objects;

/**
 * Immutable view of a {@link RoleBinding}: (organization, optional project, role).
 */
public record RoleGrant(Long organizationId, Long projectId, Role role) {

    public RoleGrant {
        Objects.requireNonNull(organizationId, "organizationId must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }

    public static RoleGrant organizationWide(Long organizationId, Role role) {
        return new RoleGrant(organizationId, null, role);
    }

    public static RoleGrant project(Long organizationId, Long projectId, Role role) {
        return new RoleGrant(organizationId, Objects.requireNonNull(projectId), role);
    }

    public boolean isOrganizationWide() {
        return projectId == null;
    }
}
