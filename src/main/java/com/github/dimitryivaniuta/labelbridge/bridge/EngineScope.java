package com.github.dimitryivaniuta.labelbridge.bridge;

import com.github.dimitryivaniuta.labelbridge.authz.Role;

import java.util.List;
import java.util.Locale;

/**
 * Least-privilege permission set requested from the annotation engine for a given role.
 */
public enum EngineScope {
    READ_ONLY(List.of("tasks:read", "annotations:read")),
    ANNOTATE(List.of("tasks:read", "annotations:read", "annotations:write")),
    MANAGE(List.of("tasks:read", "annotations:read", "annotations:write", "tasks:import", "project:update")),
    ADMIN(List.of("tasks:read", "annotations:read", "annotations:write", "tasks:import", "project:update",
            "project:admin"));

    private final List<String> permissions;

    EngineScope(List<String> permissions) {
        this.permissions = permissions;
    }

    public List<String> permissions() {
        return permissions;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EngineScope forRole(Role role) {
        switch (role) {
            case OWNER:
                return ADMIN;
            case MANAGER:
                return MANAGE;
            case ANNOTATOR:
                return ANNOTATE;
            default:
                return READ_ONLY;
        }
    }
}
