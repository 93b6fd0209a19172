package com.lbg.markets.surveillance.discovery.credential;

public class CredentialResolutionException extends RuntimeException {

    public CredentialResolutionException(String message) {
        super(message);
    }
}
