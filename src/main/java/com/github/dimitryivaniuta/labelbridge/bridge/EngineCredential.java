package com.github.dimitryivaniuta.labelbridge.bridge;

import java.time.Instant;

public record EngineCredential(String credentialId, String token, Instant expiresAt) {

    public boolean isComplete() {
        return credentialId != null && !credentialId.isBlank()
                && token != null && !token.isBlank()
                && expiresAt != null;
    }

    @Override
    public String toString() {
        return "EngineCredential[credentialId=" + credentialId + ", expiresAt=" + expiresAt + "]";
    }
}
