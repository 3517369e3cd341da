package com.github.dimitryivaniuta.labelbridge.bridge;

/**
 * The engine refused the request (401, 403 or another 4xx). Never retried.
 */
public class BridgeUnauthorizedException extends BridgeException {

    private final int status;

    public BridgeUnauthorizedException(String message, int status) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    @Override
    public String kind() {
        return "unauthorized";
    }
}
