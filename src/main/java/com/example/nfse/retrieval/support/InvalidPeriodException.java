package com.example.nfse.retrieval.support;

public class InvalidPeriodException extends RetrievalException {

    public InvalidPeriodException(String message) {
        super(message);
    }

    public InvalidPeriodException(String message, Throwable cause) {
        super(message, cause);
    }
}
