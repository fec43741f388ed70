package com.mchekin.runnerdispatch.service;

public class NoCredentialException extends RuntimeException {

    public NoCredentialException(String accountLogin) {
        super("No credential source available for account: " + accountLogin);
    }
}
