package com.example.nfse.retrieval.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CancelResponse(
        @JsonProperty("execucao_id") String jobId,
        JobStatus status,
        @JsonProperty("mensagem") String message) {

    public static CancelResponse from(JobSnapshot job) {
        String message = job.status() == JobStatus.CANCELLED
                ? "Execution cancelled"
                : "Cancellation requested; the job stops at the next checkpoint";
        return new CancelResponse(job.jobId(), job.status(), message);
    }
}
