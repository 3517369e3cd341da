package com.github.dimitryivaniuta.labelbridge.bridge;

import java.time.Instant;

/**
 * A scoped engine credential held on behalf of one principal for one project. The token never
 * leaves the server.
 */
public record BridgedSession(
        Long principalId,
        Long projectId,
        String credentialId,
        String token,
        EngineScope scope,
        Instant issuedAt,
        Instant expiresAt,
        long sequence
) {

    public boolean isLive(Instant now) {
        return expiresAt.isAfter(now);
    }

    public SessionKey key() {
        return new SessionKey(principalId, projectId);
    }

    @Override
    public String toString() {
        return "BridgedSession[principalId=" + principalId
                + ", projectId=" + projectId
                + ", credentialId=" + credentialId
                + ", scope=" + scope
                + ", expiresAt=" + expiresAt
                + ", sequence=" + sequence + "]";
    }
}
