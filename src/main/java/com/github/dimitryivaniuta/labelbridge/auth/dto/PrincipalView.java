package com.github.dimitryivaniuta.labelbridge.auth.dto;

import com.github.dimitryivaniuta.labelbridge.credential.RoleGrant;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

public record PrincipalView(
        Long id,
        String identifier,
        String displayName,
        boolean platformOperator,
        List<Membership> memberships
) {

    public record Membership(Long organizationId, Long projectId, String role) {}

    public static List<Membership> memberships(Collection<RoleGrant> grants) {
        return grants.stream()
                .sorted(Comparator.comparing(RoleGrant::organizationId)
                        .thenComparing(g -> g.projectId() == null ? 0L : g.projectId()))
                .map(g -> new Membership(g.organizationId(), g.projectId(), g.role().tag()))
                .toList();
    }
}
