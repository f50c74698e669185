package com.example.nfse.retrieval.support;

public class QueueFullException extends RetrievalException {

    public QueueFullException(String message) {
        super(message);
    }

    public QueueFullException(String message, Throwable cause) {
        super(message, cause);
    }
}
