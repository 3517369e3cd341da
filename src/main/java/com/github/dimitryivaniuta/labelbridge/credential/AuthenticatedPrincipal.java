package com.github.dimitryivaniuta.labelbridge.credential;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Request-scoped view of an authenticated principal together with its role grants at the time
 * the request was authenticated.
 */
public record AuthenticatedPrincipal(
        Long id,
        String identifier,
        String displayName,
        boolean platformOperator,
        long tokenGeneration,
        Set<RoleGrant> grants
) {

    public AuthenticatedPrincipal {
        Objects.requireNonNull(id, "id must not be null");
        grants = grants == null ? Set.of() : Set.copyOf(grants);
    }

    public boolean isMemberOf(Long organizationId) {
        return grants.stream().anyMatch(g -> g.organizationId().equals(organizationId));
    }

    public Optional<RoleGrant> organizationGrant(Long organizationId) {
        return grants.stream()
                .filter(g -> g.isOrganizationWide() && g.organizationId().equals(organizationId))
                .findFirst();
    }

    public Optional<RoleGrant> projectGrant(Long organizationId, Long projectId) {
        return grants.stream()
                .filter(g -> g.organizationId().equals(organizationId) && projectId.equals(g.projectId()))
                .findFirst();
    }
}
