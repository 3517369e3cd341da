package com.github.dimitryivaniuta.labelbridge.gateway;

import com.github.dimitryivaniuta.labelbridge.authz.AccessDecision;
import com.github.dimitryivaniuta.labelbridge.authz.Action;
import com.github.dimitryivaniuta.labelbridge.authz.AuthorizationEngine;
import com.github.dimitryivaniuta.labelbridge.authz.ResourcePath;
import com.github.dimitryivaniuta.labelbridge.authz.Role;
import com.github.dimitryivaniuta.labelbridge.bridge.BridgedSession;
import com.github.dimitryivaniuta.labelbridge.bridge.SessionBridge;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.tenancy.ResourceDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.function.Function;

/**
 * Runs the per-resource half of the request pipeline for already authenticated callers:
 * authorization, then (for engine-backed routes) the session bridge, then the handler.
 * Any denial throws before the handler is invoked.
 */
@Component
@RequiredArgsConstructor
public class RequestGateway {

    /** Bridged role of platform operators without a binding; covers every engine-backed route. */
    static final Role OPERATOR_BRIDGE_ROLE = Role.MANAGER;

    private final AuthorizationEngine authorizationEngine;
    private final SessionBridge sessionBridge;
    private final ResourceDirectory directory;

    public <T> T authorize(AuthenticatedPrincipal principal,
                           ResourcePath path,
                           Action action,
                           Function<AccessDecision, T> handler) {
        AccessDecision decision = authorizationEngine.authorize(principal, path, action).orThrow();
        return handler.apply(decision);
    }

    /**
     * @param handler receives the decision and a live bridged session for the path's project
     */
    public <T> T bridged(AuthenticatedPrincipal principal,
                         ResourcePath path,
                         Action action,
                         Function<BridgedContext, T> handler) {
        if (!path.targetsProject()) {
            throw new IllegalArgumentException("Bridged routes must target a project: " + path.ref());
        }
        AccessDecision decision = authorizationEngine.authorize(principal, path, action).orThrow();

        Long engineProjectId = directory.engineProjectId(path)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.CONFLICT,
                        "Project is not linked to the annotation engine"));

        // one scope per project for operators, whatever the route, so their sessions are reused
        Role role = decision.effectiveRole() != null ? decision.effectiveRole() : OPERATOR_BRIDGE_ROLE;
        BridgedSession session = sessionBridge.acquire(principal.id(), role, path.projectId(), engineProjectId);
        return handler.apply(new BridgedContext(decision, session, engineProjectId));
    }
}
