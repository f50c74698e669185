package com.example.nfse.retrieval.support;

public class ArtifactWriteException extends RetrievalException {

    public ArtifactWriteException(String message) {
        super(message);
    }

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
