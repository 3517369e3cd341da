package com.github.dimitryivaniuta.labelbridge.authz;

/**
 * {@code NOT_FOUND} covers both missing resources and resources outside the caller's
 * organizations, so existence does not leak across tenants.
 */
public enum DenyReason {
    NOT_FOUND,
    FORBIDDEN
}
