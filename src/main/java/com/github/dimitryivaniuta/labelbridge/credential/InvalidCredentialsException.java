package com.github.dimitryivaniuta.labelbridge.credential;

public class InvalidCredentialsException extends AuthenticationFailedException {

    public InvalidCredentialsException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "invalid_credentials";
    }
}
