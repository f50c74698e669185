package com.example.nfse.retrieval.support;

public class JobNotFoundException extends RetrievalException {

    public JobNotFoundException(String message) {
        super(message);
    }

    public JobNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
