package com.example.nfse.retrieval.support;

public class CompanyNotFoundException extends RetrievalException {

    public CompanyNotFoundException(String message) {
        super(message);
    }

    public CompanyNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
