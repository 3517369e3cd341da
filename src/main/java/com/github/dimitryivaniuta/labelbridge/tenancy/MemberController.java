package com.github.dimitryivaniuta.labelbridge.tenancy;

import com.github.dimitryivaniuta.labelbridge.authz.Action;
import com.github.dimitryivaniuta.labelbridge.authz.ResourcePath;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.gateway.RequestGateway;
import com.github.dimitryivaniuta.labelbridge.tenancy.dto.AssignRoleRequest;
import com.github.dimitryivaniuta.labelbridge.tenancy.dto.MembershipResponse;
import com.github.dimitryivaniuta.labelbridge.web.RequestContextKeys;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Membership administration. All routes require {@code ADMIN} on the organization.
 */
@RestController
@RequestMapping("/api/organizations/{orgId}/members/{principalId}")
@RequiredArgsConstructor
public class MemberController {

    private final MembershipService memberships;
    private final RequestGateway gateway;

    @PutMapping
    public MembershipResponse assignRole(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable Long orgId,
            @PathVariable Long principalId,
            @Valid @RequestBody AssignRoleRequest req) {
        return gateway.authorize(principal, ResourcePath.organization(orgId), Action.ADMIN, decision ->
                MembershipResponse.from(
                        memberships.assignRole(principal.id(), orgId, principalId, req.role(), req.projectId())));
    }

    @DeleteMapping
    public ResponseEntity<Void> removeMember(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable Long orgId,
            @PathVariable Long principalId) {
        return gateway.authorize(principal, ResourcePath.organization(orgId), Action.ADMIN, decision -> {
            memberships.removeMember(principal.id(), orgId, principalId);
            return ResponseEntity.noContent().build();
        });
    }

    @PostMapping("/deactivate")
    public ResponseEntity<Void> deactivate(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable Long orgId,
            @PathVariable Long principalId) {
        return gateway.authorize(principal, ResourcePath.organization(orgId), Action.ADMIN, decision -> {
            memberships.deactivateMember(principal.id(), orgId, principalId);
            return ResponseEntity.noContent().build();
        });
    }
}
