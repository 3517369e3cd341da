package com.github.dimitryivaniuta.labelbridge.authz;

import lombok.Getter;

@Getter
public class AccessDeniedException extends RuntimeException {

    private final DenyReason reason;

    public AccessDeniedException(DenyReason reason) {
        super(reason == DenyReason.NOT_FOUND ? "Not found" : "Access denied");
        this.reason = reason;
    }
}
