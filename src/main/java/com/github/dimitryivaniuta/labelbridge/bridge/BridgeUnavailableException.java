package com.github.dimitryivaniuta.labelbridge.bridge;

/**
 * Transient: IO failure, timeout, 5xx, 429, or a session revoked while it was being issued.
 * Safe to retry.
 */
public class BridgeUnavailableException extends BridgeException {

    public static final long DEFAULT_RETRY_AFTER_SECONDS = 5;

    public BridgeUnavailableException(String message) {
        super(message);
    }

    public BridgeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "unavailable";
    }
}
