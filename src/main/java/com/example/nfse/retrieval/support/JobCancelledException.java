package com.example.nfse.retrieval.support;

public class JobCancelledException extends RetrievalException {

    public JobCancelledException(String jobId) {
        super("Job %s was cancelled".formatted(jobId));
    }

    @Override
    public String errorType() {
        return "Cancelled";
    }
}
