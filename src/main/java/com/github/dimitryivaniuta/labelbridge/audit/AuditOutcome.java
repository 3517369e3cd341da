package com.github.dimitryivaniuta.labelbridge.audit;

public enum AuditOutcome {
    ALLOW,
    DENY,
    ERROR
}
