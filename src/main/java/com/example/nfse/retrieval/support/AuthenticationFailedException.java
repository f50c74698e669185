package com.example.nfse.retrieval.support;

public class AuthenticationFailedException extends RetrievalException {

    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
