package com.github.dimitryivaniuta.labelbridge.tenancy.dto;

import com.github.dimitryivaniuta.labelbridge.credential.RoleBinding;

public record MembershipResponse(Long principalId, Long organizationId, Long projectId, String role) {

    public static MembershipResponse from(RoleBinding b) {
        return new MembershipResponse(b.getPrincipalId(), b.getOrganizationId(), b.getProjectId(), b.getRole().tag());
    }
}
