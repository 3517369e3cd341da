package com.github.dimitryivaniuta.labelbridge.authz;

import com.github.dimitryivaniuta.labelbridge.audit.AuditEvent;
import com.github.dimitryivaniuta.labelbridge.audit.AuditEventKind;
import com.github.dimitryivaniuta.labelbridge.audit.AuditLog;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.credential.RoleGrant;
import com.github.dimitryivaniuta.labelbridge.metrics.LabelBridgeMetrics;
import com.github.dimitryivaniuta.labelbridge.tenancy.ResourceDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether a principal may perform an action on a tenant resource.
 *
 * <ol>
 *   <li>Non-members of the owning organization get {@link DenyReason#NOT_FOUND}.</li>
 *   <li>Paths that do not resolve get {@link DenyReason#NOT_FOUND}.</li>
 *   <li>Platform operators are permitted.</li>
 *   <li>The most specific applicable grant is compared by rank with the action's minimum role.</li>
 * </ol>
 *
 * Every deny is audited, permits only for privileged actions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorizationEngine {

    private final ResourceDirectory directory;
    private final AuditLog auditLog;
    private final LabelBridgeMetrics metrics;

    public AccessDecision authorize(AuthenticatedPrincipal principal, ResourcePath path, Action action) {
        return authorize(principal, principal.grants(), path, action);
    }

    public AccessDecision authorize(AuthenticatedPrincipal principal,
                                    Collection<RoleGrant> bindings,
                                    ResourcePath path,
                                    Action action) {
        long start = System.nanoTime();
        try {
            AccessDecision decision = decide(principal, bindings, path, action);
            audit(principal, path, action, decision);
            return decision;
        } finally {
            metrics.recordDuration("label_bridge_authorization_seconds", action.name().toLowerCase(Locale.ROOT),
                    System.nanoTime() - start);
        }
    }

    private AccessDecision decide(AuthenticatedPrincipal principal,
                                  Collection<RoleGrant> bindings,
                                  ResourcePath path,
                                  Action action) {
        boolean member = bindings.stream().anyMatch(g -> g.organizationId().equals(path.organizationId()));
        if (!member && !principal.platformOperator()) {
            return AccessDecision.deny(DenyReason.NOT_FOUND);
        }
        if (!directory.resolves(path)) {
            return AccessDecision.deny(DenyReason.NOT_FOUND);
        }

        Optional<Role> effective = effectiveRole(bindings, path);
        if (principal.platformOperator()) {
            return AccessDecision.permit(effective.orElse(null));
        }
        if (effective.isEmpty() || !effective.get().atLeast(action.requiredRole())) {
            return AccessDecision.deny(DenyReason.FORBIDDEN);
        }
        return AccessDecision.permit(effective.get());
    }

    /**
     * Project-scoped grant for the target project if present, otherwise the organization-wide
     * grant. Grants for other projects never apply.
     */
    static Optional<Role> effectiveRole(Collection<RoleGrant> bindings, ResourcePath path) {
        if (path.targetsProject()) {
            Optional<Role> narrowed = bindings.stream()
                    .filter(g -> g.organizationId().equals(path.organizationId())
                            && path.projectId().equals(g.projectId()))
                    .map(RoleGrant::role)
                    .findFirst();
            if (narrowed.isPresent()) {
                return narrowed;
            }
        }
        return bindings.stream()
                .filter(g -> g.isOrganizationWide() && g.organizationId().equals(path.organizationId()))
                .map(RoleGrant::role)
                .findFirst();
    }

    private void audit(AuthenticatedPrincipal principal, ResourcePath path, Action action, AccessDecision decision) {
        String ref = path.ref() + " " + action.name();
        if (!decision.permitted()) {
            String reason = decision.reason().name().toLowerCase(Locale.ROOT);
            metrics.authorizationDenied(reason);
            log.debug("Authorization denied principal={} path={} action={} reason={}",
                    principal.id(), path.ref(), action, reason);
            auditLog.record(AuditEvent.deny(principal.id(), AuditEventKind.AUTHORIZATION, ref, reason));
        } else if (action.isPrivileged()) {
            auditLog.record(AuditEvent.allow(principal.id(), AuditEventKind.AUTHORIZATION, ref));
        }
    }
}
