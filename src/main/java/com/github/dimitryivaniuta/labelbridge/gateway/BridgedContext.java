package com.github.dimitryivaniuta.labelbridge.gateway;

import com.github.dimitryivaniuta.labelbridge.authz.AccessDecision;
import com.github.dimitryivaniuta.labelbridge.bridge.BridgedSession;

/**
 * Handed to engine-backed handlers once authorization passed and a session is live.
 */
public record BridgedContext(AccessDecision decision, BridgedSession session, Long engineProjectId) {

    public String sessionToken() {
        return session.token();
    }
}
