package com.example.nfse.retrieval.support;

import java.time.Duration;

/** A portal wait or request exceeded its timeout. Row-fatal while scanning, job-fatal during authentication. */
public class PortalTimeoutException extends RetrievalException {

    private final String operation;
    private final Duration timeout;

    public PortalTimeoutException(String operation, Duration timeout, Throwable cause) {
        super("Timed out after %d ms waiting for %s".formatted(timeout.toMillis(), operation), cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String errorType() {
        return "Timeout";
    }
}
