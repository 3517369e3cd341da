package com.github.dimitryivaniuta.labelbridge.bridge;

/**
 * Failure talking to the annotation engine. Subtypes tell transient failures apart from refusals.
 */
public abstract class BridgeException extends RuntimeException {

    protected BridgeException(String message) {
        super(message);
    }

    protected BridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String kind();
}
