package com.example.nfse.retrieval.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record ExecutionStatusResponse(
        @JsonProperty("execucao_id") String jobId,
        @JsonProperty("empresa_id") String companyId,
        String cnpj,
        @JsonProperty("competencia") String billingPeriod,
        @JsonProperty("tipo") String directionFilter,
        JobStatus status,
        @JsonProperty("progresso") int progressPercent,
        @JsonProperty("mensagem") String message,
        List<String> logs,
        @JsonProperty("etapa_atual") JobStage stage,
        @JsonProperty("data_inicio") Instant startedAt,
        @JsonProperty("data_fim") Instant finishedAt,
        @JsonProperty("erro") String lastErrorMessage,
        @JsonProperty("url_atual") String currentUrl,
        @JsonProperty("titulo") String pageTitle,
        @JsonProperty("arquivos_gravados") int artifactsWritten,
        @JsonProperty("falhas_linha") int rowFailures) {

    public static ExecutionStatusResponse from(JobSnapshot job) {
        return new ExecutionStatusResponse(
                job.jobId(),
                job.companyId(),
                job.cnpj(),
                job.billingPeriod().compact(),
                job.directionFilter().wireValue(),
                job.status(),
                job.progressPercent(),
                job.message(),
                job.logs(),
                job.stage(),
                job.startedAt() != null ? job.startedAt() : job.createdAt(),
                job.status().isTerminal() ? job.finishedAt() : null,
                job.lastErrorMessage(),
                job.currentUrl(),
                job.pageTitle(),
                job.artifactsWritten(),
                job.rowFailures());
    }
}
