package com.github.dimitryivaniuta.labelbridge.credential;

public class AccountDisabledException extends AuthenticationFailedException {

    public AccountDisabledException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "account_disabled";
    }
}
