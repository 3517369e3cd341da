package com.github.dimitryivaniuta.labelbridge.auth;

import com.github.dimitryivaniuta.labelbridge.credential.AuthenticationFailedException;

public class InvalidTokenException extends AuthenticationFailedException {

    public InvalidTokenException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "invalid_token";
    }
}
