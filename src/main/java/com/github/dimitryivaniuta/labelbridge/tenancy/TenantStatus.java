package com.github.dimitryivaniuta.labelbridge.tenancy;

public enum TenantStatus {
    ACTIVE,
    SUSPENDED
}
