package com.example.nfse.retrieval.support;

public class AlreadyRunningException extends RetrievalException {

    public AlreadyRunningException(String message) {
        super(message);
    }

    public AlreadyRunningException(String message, Throwable cause) {
        super(message, cause);
    }
}
