package com.github.dimitryivaniuta.labelbridge.audit;

public enum AuditEventKind {
    LOGIN,
    LOGOUT,
    REGISTRATION,
    SECRET_ROTATION,
    ROLE_CHANGE,
    PRINCIPAL_DEACTIVATED,
    AUTHORIZATION,
    SESSION_ISSUED,
    SESSION_REVOKED,
    RATE_LIMITED
}
