package com.example.nfse.retrieval.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JobSnapshot")
class JobSnapshotTest {

    private static final Instant NOW = Instant.parse("2025-11-20T13:05:09Z");

    private JobSnapshot pending() {
        Company company = new Company("c-1", "12345678000199", "Padaria Central", CompanyRegime.SIMPLES);
        return JobSnapshot.pending("job-1", company, BillingPeriod.parse("112025"), DirectionFilter.AMBAS, true, NOW);
    }

    @Test
    @DisplayName("Should start pending in the queued stage with no progress")
    void pendingDefaults() {
        JobSnapshot snapshot = pending();

        assertEquals(JobStatus.PENDING, snapshot.status());
        assertEquals(JobStage.QUEUED, snapshot.stage());
        assertEquals(0, snapshot.progressPercent());
        assertEquals("c-1", snapshot.companyId());
        assertEquals("12345678000199", snapshot.cnpj());
        assertTrue(snapshot.logs().isEmpty());
    }

    @Test
    @DisplayName("Should prefix log lines with the local time and keep only the newest entries")
    void logsAreTimestampedAndBounded() {
        JobSnapshot snapshot = pending()
                .withLog("first", NOW, ZoneOffset.UTC, 2)
                .withLog("second", NOW, ZoneOffset.UTC, 2)
                .withLog("third", NOW.plusSeconds(1), ZoneOffset.UTC, 2);

        assertEquals(List.of("[13:05:09] second", "[13:05:10] third"), snapshot.logs());
    }

    @Test
    @DisplayName("Should never lower progress")
    void progressIsMonotonic() {
        JobSnapshot at40 = pending().withProgress(40);
        JobSnapshot lower = at40.withProgress(10);

        assertSame(at40, lower);
        assertEquals(40, lower.progressPercent());
        assertEquals(100, at40.withProgress(250).progressPercent());
    }

    @Test
    @DisplayName("Should allow only forward status transitions")
    void statusTransitions() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED));
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.SUCCEEDED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED));
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.PENDING));
        assertFalse(JobStatus.SUCCEEDED.canTransitionTo(JobStatus.RUNNING));
        assertFalse(JobStatus.CANCELLED.canTransitionTo(JobStatus.FAILED));
    }
}
