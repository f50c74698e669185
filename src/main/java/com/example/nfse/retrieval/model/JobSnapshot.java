package com.example.nfse.retrieval.model;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;

/**
 * Immutable view of a job at one instant. Every change produces a new
 * snapshot, so pollers never observe a partially applied update.
 */
@Builder(toBuilder = true)
public record JobSnapshot(
        String jobId,
        String companyId,
        String cnpj,
        String companyName,
        BillingPeriod billingPeriod,
        DirectionFilter directionFilter,
        boolean headless,
        JobStatus status,
        JobStage stage,
        int progressPercent,
        String message,
        List<String> logs,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        String lastErrorMessage,
        String currentUrl,
        String pageTitle,
        int artifactsWritten,
        int rowFailures) {

    private static final DateTimeFormatter LOG_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    public JobSnapshot {
        logs = logs == null ? List.of() : List.copyOf(logs);
        progressPercent = Math.max(0, Math.min(100, progressPercent));
    }

    public static JobSnapshot pending(String jobId, Company company, BillingPeriod period,
            DirectionFilter filter, boolean headless, Instant now) {
        return JobSnapshot.builder()
                .jobId(jobId)
                .companyId(company.getId())
                .cnpj(company.getCnpj())
                .companyName(company.getRazaoSocial())
                .billingPeriod(period)
                .directionFilter(filter)
                .headless(headless)
                .status(JobStatus.PENDING)
                .stage(JobStage.QUEUED)
                .progressPercent(0)
                .message("Waiting for a free browser slot")
                .logs(List.of())
                .createdAt(now)
                .build();
    }

    public JobSnapshot withLog(String message, Instant at, ZoneId zone, int maxEntries) {
        List<String> appended = new ArrayList<>(logs.size() + 1);
        appended.addAll(logs);
        appended.add("[%s] %s".formatted(LocalTime.ofInstant(at, zone).format(LOG_TIME), message));
        int overflow = appended.size() - Math.max(1, maxEntries);
        List<String> retained = overflow > 0 ? appended.subList(overflow, appended.size()) : appended;
        return toBuilder().logs(retained).build();
    }

    /** Progress only moves forward; a lower value leaves the snapshot unchanged. */
    public JobSnapshot withProgress(int percent) {
        return percent <= progressPercent ? this : toBuilder().progressPercent(percent).build();
    }
}
