package com.github.dimitryivaniuta.labelbridge.bridge;

import java.util.Objects;

/** One bridged session slot per (principal, project). */
public record SessionKey(Long principalId, Long projectId) {

    public SessionKey {
        Objects.requireNonNull(principalId, "principalId must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
    }
}
