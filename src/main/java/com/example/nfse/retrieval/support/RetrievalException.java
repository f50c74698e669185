package com.example.nfse.retrieval.support;

/**
 * Base type for every failure raised by the retrieval pipeline. The error
 * type is the short name surfaced in job logs and API error bodies.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }

    public String errorType() {
        String name = getClass().getSimpleName();
        return name.endsWith("Exception") ? name.substring(0, name.length() - "Exception".length()) : name;
    }
}
