package com.github.dimitryivaniuta.labelbridge.credential;

public class WeakSecretException extends RuntimeException {

    public WeakSecretException(String message) {
        super(message);
    }
}
