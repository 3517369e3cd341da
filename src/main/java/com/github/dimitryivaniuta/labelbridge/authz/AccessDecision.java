package com.github.dimitryivaniuta.labelbridge.authz;

/**
 * Result of {@link AuthorizationEngine#authorize}. A permit carries the effective role the caller
 * holds on the resource (null for platform operators without a binding).
 */
public record AccessDecision(boolean permitted, Role effectiveRole, DenyReason reason) {

    public static AccessDecision permit(Role effectiveRole) {
        return new AccessDecision(true, effectiveRole, null);
    }

    public static AccessDecision deny(DenyReason reason) {
        return new AccessDecision(false, null, reason);
    }

    /** Throws {@link AccessDeniedException} when this is a deny; returns this otherwise. */
    public AccessDecision orThrow() {
        if (!permitted) {
            throw new AccessDeniedException(reason);
        }
        return this;
    }
}
