package com.github.dimitryivaniuta.labelbridge.credential;

/**
 * Base of all authentication failures. Subtypes exist for logging and metrics;
 * clients only ever see a generic denial.
 */
public abstract class AuthenticationFailedException extends RuntimeException {

    protected AuthenticationFailedException(String message) {
        super(message);
    }

    /** Stable tag for metrics and audit reasons. */
    public abstract String kind();
}
