package com.github.dimitryivaniuta.labelbridge.authz;

/**
 * What a caller wants to do to a resource, with the minimum role that allows it.
 */
public enum Action {
    READ(Role.VIEWER),
    WRITE(Role.ANNOTATOR),
    MANAGE(Role.MANAGER),
    ADMIN(Role.OWNER);

    private final Role requiredRole;

    Action(Role requiredRole) {
        this.requiredRole = requiredRole;
    }

    public Role requiredRole() {
        return requiredRole;
    }

    /** Permits of privileged actions are audited, not only denials. */
    public boolean isPrivileged() {
        return this == MANAGE || this == ADMIN;
    }
}
