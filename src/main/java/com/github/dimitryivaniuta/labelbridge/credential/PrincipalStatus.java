package com.github.dimitryivaniuta.labelbridge.credential;

public enum PrincipalStatus {
    ACTIVE,
    DEACTIVATED
}
