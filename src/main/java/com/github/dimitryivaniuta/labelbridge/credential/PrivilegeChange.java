package com.github.dimitryivaniuta.labelbridge.credential;

import java.util.Locale;

public enum PrivilegeChange {
    ROLE_CHANGED,
    ROLE_REMOVED,
    DEACTIVATED,
    SECRET_ROTATED,
    LOGGED_OUT;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
