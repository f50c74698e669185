package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.model.JobSnapshot;
import com.example.nfse.retrieval.model.JobStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * jobId to immutable snapshot. Updates replace the whole snapshot atomically
 * per job; a status change that would move backwards is rejected. Entries
 * leave the store only through {@link #evict} or
 * {@link #evictTerminalOlderThan}.
 */
@Slf4j
@Component
public class StatusStore {

    private final Map<String, JobSnapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<String, String> latestByCompany = new ConcurrentHashMap<>();

    public void put(JobSnapshot snapshot) {
        snapshots.put(snapshot.jobId(), snapshot);
        latestByCompany.put(snapshot.companyId(), snapshot.jobId());
    }

    public Optional<JobSnapshot> get(String jobId) {
        return Optional.ofNullable(snapshots.get(jobId));
    }

    public Optional<JobSnapshot> latestForCompany(String companyId) {
        String jobId = latestByCompany.get(companyId);
        return jobId == null ? Optional.empty() : get(jobId);
    }

    /**
     * Applies {@code change} to the current snapshot. Returns the stored
     * snapshot, which is the previous one when the change was an illegal
     * status transition.
     */
    public Optional<JobSnapshot> update(String jobId, UnaryOperator<JobSnapshot> change) {
        return Optional.ofNullable(snapshots.computeIfPresent(jobId, (id, current) -> {
            JobSnapshot next = change.apply(current);
            if (next == null) {
                return current;
            }
            if (next.status() != current.status() && !current.status().canTransitionTo(next.status())) {
                log.warn("Ignoring status change job={} from={} to={}", id, current.status(), next.status());
                return current;
            }
            return next;
        }));
    }

    public boolean hasActiveJob(String companyId) {
        return latestForCompany(companyId)
                .map(snapshot -> snapshot.status().isActive())
                .orElse(false);
    }

    public Optional<JobSnapshot> evict(String jobId) {
        JobSnapshot removed = snapshots.remove(jobId);
        if (removed != null) {
            latestByCompany.remove(removed.companyId(), jobId);
        }
        return Optional.ofNullable(removed);
    }

    public int evictTerminalOlderThan(Instant cutoff) {
        List<String> expired = new ArrayList<>();
        snapshots.forEach((jobId, snapshot) -> {
            if (snapshot.status().isTerminal()
                    && snapshot.finishedAt() != null
                    && snapshot.finishedAt().isBefore(cutoff)) {
                expired.add(jobId);
            }
        });
        expired.forEach(this::evict);
        return expired.size();
    }

    public int size() {
        return snapshots.size();
    }

    public long count(JobStatus status) {
        return snapshots.values().stream().filter(snapshot -> snapshot.status() == status).count();
    }
}
