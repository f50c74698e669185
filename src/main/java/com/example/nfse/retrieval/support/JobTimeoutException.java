package com.example.nfse.retrieval.support;

import java.time.Duration;

public class JobTimeoutException extends RetrievalException {

    public JobTimeoutException(String jobId, Duration limit) {
        super("Job %s exceeded the company timeout of %d s".formatted(jobId, limit.toSeconds()));
    }

    @Override
    public String errorType() {
        return "Timeout";
    }
}
