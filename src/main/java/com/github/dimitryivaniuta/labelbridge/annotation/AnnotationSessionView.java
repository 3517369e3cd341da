package com.github.dimitryivaniuta.labelbridge.annotation;

import com.github.dimitryivaniuta.labelbridge.bridge.BridgedSession;

import java.time.Instant;

/**
 * What a client learns about its bridged session. The engine credential itself stays server-side.
 */
public record AnnotationSessionView(Long projectId, long sequence, String scope, Instant expiresAt) {

    public static AnnotationSessionView from(BridgedSession s) {
        return new AnnotationSessionView(s.projectId(), s.sequence(), s.scope().tag(), s.expiresAt());
    }
}
