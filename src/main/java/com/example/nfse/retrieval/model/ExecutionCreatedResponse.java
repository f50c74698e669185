package com.example.nfse.retrieval.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record ExecutionCreatedResponse(
        @JsonProperty("execucao_id") String jobId,
        @JsonProperty("empresa_id") String companyId,
        String cnpj,
        JobStatus status,
        @JsonProperty("progresso") int progressPercent,
        @JsonProperty("mensagem") String message,
        List<String> logs,
        @JsonProperty("etapa_atual") JobStage stage,
        @JsonProperty("data_inicio") Instant createdAt) {

    public static ExecutionCreatedResponse from(JobSnapshot job) {
        return new ExecutionCreatedResponse(
                job.jobId(),
                job.companyId(),
                job.cnpj(),
                job.status(),
                job.progressPercent(),
                job.message(),
                job.logs(),
                job.stage(),
                job.createdAt());
    }
}
