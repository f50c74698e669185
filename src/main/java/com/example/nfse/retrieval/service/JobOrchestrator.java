package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.config.AutomationProperties;
import com.example.nfse.retrieval.model.Artifact;
import com.example.nfse.retrieval.model.ArtifactLocation;
import com.example.nfse.retrieval.model.BillingPeriod;
import com.example.nfse.retrieval.model.Company;
import com.example.nfse.retrieval.model.Direction;
import com.example.nfse.retrieval.model.DirectionFilter;
import com.example.nfse.retrieval.model.JobSnapshot;
import com.example.nfse.retrieval.model.JobStage;
import com.example.nfse.retrieval.model.JobStatus;
import com.example.nfse.retrieval.model.ScanProgress;
import com.example.nfse.retrieval.model.ScanReport;
import com.example.nfse.retrieval.portal.PortalSession;
import com.example.nfse.retrieval.portal.PortalSessionFactory;
import com.example.nfse.retrieval.portal.PortalTable;
import com.example.nfse.retrieval.portal.SessionFacts;
import com.example.nfse.retrieval.support.AlreadyRunningException;
import com.example.nfse.retrieval.support.ArtifactWriteException;
import com.example.nfse.retrieval.support.AuthenticationFailedException;
import com.example.nfse.retrieval.support.JobCancelledException;
import com.example.nfse.retrieval.support.JobNotFoundException;
import com.example.nfse.retrieval.support.JobTimeoutException;
import com.example.nfse.retrieval.support.PortalTimeoutException;
import com.example.nfse.retrieval.support.QueueFullException;
import com.example.nfse.retrieval.support.RetrievalException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Queues retrieval jobs and runs each one on a worker: authenticate, scan the
 * requested directions, finalize. One job per company may be pending or
 * running at a time.
 */
@Slf4j
@Service
public class JobOrchestrator {

    static final int AUTHENTICATION_WEIGHT = 5;
    static final int SCAN_WEIGHT = 90;
    static final int COMPLETE = 100;

    private final CompanyDirectory companies;
    private final StatusStore store;
    private final PortalSessionFactory sessions;
    private final TableScanner scanner;
    private final ManifestWriter manifestWriter;
    private final PathBuilder pathBuilder;
    private final ExecutorService executor;
    private final AutomationProperties automation;
    private final Clock clock;
    private final ZoneId zone;
    private final Object admissionLock = new Object();
    private final Map<String, AtomicBoolean> cancellations = new ConcurrentHashMap<>();

    @Autowired
    public JobOrchestrator(CompanyDirectory companies,
            StatusStore store,
            PortalSessionFactory sessions,
            TableScanner scanner,
            ManifestWriter manifestWriter,
            PathBuilder pathBuilder,
            ExecutorService retrievalExecutor,
            AutomationProperties automation) {
        this(companies, store, sessions, scanner, manifestWriter, pathBuilder, retrievalExecutor, automation,
                Clock.systemUTC());
    }

    JobOrchestrator(CompanyDirectory companies,
            StatusStore store,
            PortalSessionFactory sessions,
            TableScanner scanner,
            ManifestWriter manifestWriter,
            PathBuilder pathBuilder,
            ExecutorService executor,
            AutomationProperties automation,
            Clock clock) {
        this.companies = companies;
        this.store = store;
        this.sessions = sessions;
        this.scanner = scanner;
        this.manifestWriter = manifestWriter;
        this.pathBuilder = pathBuilder;
        this.executor = executor;
        this.automation = automation;
        this.clock = clock;
        this.zone = automation.zone();
    }

    public JobSnapshot submit(String companyIdentifier, String competencia, String tipo, Boolean headless) {
        BillingPeriod period = BillingPeriod.parse(competencia);
        DirectionFilter filter = DirectionFilter.fromWire(tipo);
        Company company = companies.resolve(companyIdentifier);
        boolean runHeadless = headless != null ? headless : automation.isHeadless();

        String jobId = UUID.randomUUID().toString();
        synchronized (admissionLock) {
            if (store.hasActiveJob(company.getId())) {
                log.warn("Rejecting job for company={} because another job is in progress", company.getId());
                throw new AlreadyRunningException(
                        "A job is already pending or running for company %s".formatted(company.getId()));
            }
            JobSnapshot pending = JobSnapshot.pending(jobId, company, period, filter, runHeadless, now())
                    .withLog("Queued %s for %s (%s)".formatted(filter.wireValue(), period.display(),
                            company.getRazaoSocial()), now(), zone, automation.getMaxLogEntries());
            store.put(pending);
            cancellations.put(jobId, new AtomicBoolean());
            try {
                executor.execute(() -> execute(jobId, company));
            } catch (RejectedExecutionException ex) {
                store.evict(jobId);
                cancellations.remove(jobId);
                log.warn("Rejecting job for company={} because the queue is full", company.getId());
                throw new QueueFullException("The retrieval queue is full, try again later", ex);
            }
        }
        log.info("Accepted job={} company={} period={} directions={} headless={}",
                jobId, company.getId(), period.compact(), filter.wireValue(), runHeadless);
        return status(jobId);
    }

    public JobSnapshot status(String jobId) {
        return store.get(jobId).orElseThrow(() -> new JobNotFoundException("Job %s not found".formatted(jobId)));
    }

    public JobSnapshot statusForCompany(String companyIdentifier) {
        Company company = companies.resolve(companyIdentifier);
        return store.latestForCompany(company.getId())
                .orElseThrow(() -> new JobNotFoundException(
                        "No job recorded for company %s".formatted(companyIdentifier)));
    }

    /** Accepts a job id or a company identifier. */
    public JobSnapshot lookup(String identifier) {
        return store.get(identifier).orElseGet(() -> statusForCompany(identifier));
    }

    /**
     * Pending jobs are cancelled at once; running jobs stop at their next
     * checkpoint. Cancelling a finished job returns it unchanged.
     */
    public JobSnapshot cancel(String jobId) {
        JobSnapshot current = status(jobId);
        if (current.status().isTerminal()) {
            return current;
        }
        AtomicBoolean flag = cancellations.get(jobId);
        if (flag != null) {
            flag.set(true);
        }
        if (current.status() == JobStatus.PENDING) {
            record(jobId, "Cancelled before start", snapshot -> snapshot.status() != JobStatus.PENDING
                    ? snapshot
                    : terminal(snapshot, JobStatus.CANCELLED, "Cancelled", null));
        } else {
            record(jobId, "Cancellation requested", snapshot -> snapshot);
        }
        log.info("Cancellation requested job={} status={}", jobId, current.status());
        return status(jobId);
    }

    public JobSnapshot evict(String jobId) {
        JobSnapshot current = status(jobId);
        if (current.status().isActive()) {
            throw new AlreadyRunningException("Job %s is still %s".formatted(jobId, current.status().wireValue()));
        }
        store.evict(jobId);
        log.info("Evicted job={} status={}", jobId, current.status());
        return current;
    }

    void execute(String jobId, Company company) {
        AtomicBoolean cancelled = cancellations.getOrDefault(jobId, new AtomicBoolean());
        try {
            JobStatus queued = store.get(jobId).map(JobSnapshot::status).orElse(null);
            if (queued != JobStatus.PENDING) {
                log.info("Job={} left the queue in status={}, skipping", jobId, queued == null ? "evicted" : queued);
                return;
            }
            JobSnapshot started = record(jobId, "Started", snapshot -> snapshot.status() != JobStatus.PENDING
                    ? snapshot
                    : snapshot.toBuilder()
                            .status(JobStatus.RUNNING)
                            .stage(JobStage.AUTHENTICATE)
                            .startedAt(now())
                            .message("Authenticating with the company certificate")
                            .build());
            if (started == null || started.status() != JobStatus.RUNNING) {
                log.info("Job={} left the queue in status={}, skipping", jobId,
                        started == null ? "evicted" : started.status());
                return;
            }
            run(started, company, cancelled);
        } finally {
            cancellations.remove(jobId);
        }
    }

    private void run(JobSnapshot job, Company company, AtomicBoolean cancelled) {
        String jobId = job.jobId();
        Duration limit = automation.getCompanyTimeout();
        Instant deadline = now().plus(limit);
        Checkpoint checkpoint = () -> {
            if (cancelled.get()) {
                throw new JobCancelledException(jobId);
            }
            if (now().isAfter(deadline)) {
                throw new JobTimeoutException(jobId, limit);
            }
        };

        List<ScanReport> reports = new ArrayList<>();
        try (PortalSession session = sessions.open(company, job.headless())) {
            checkpoint.check();
            SessionFacts facts = authenticate(session);
            record(jobId, "Authenticated at %s".formatted(facts.url()), snapshot -> snapshot.toBuilder()
                    .currentUrl(facts.url())
                    .pageTitle(facts.title())
                    .build()
                    .withProgress(AUTHENTICATION_WEIGHT));

            List<Direction> directions = job.directionFilter().directions();
            int share = SCAN_WEIGHT / directions.size();
            for (int i = 0; i < directions.size(); i++) {
                Direction direction = directions.get(i);
                int start = AUTHENTICATION_WEIGHT + i * share;
                checkpoint.check();
                record(jobId, "Scanning %s".formatted(direction.folderName()), snapshot -> snapshot.toBuilder()
                        .stage(JobStage.scanning(direction))
                        .message("Scanning %s notes of %s".formatted(direction.wireValue(), job.billingPeriod()))
                        .build());

                PortalTable table = session.openTable(direction);
                ArtifactLocation location = new ArtifactLocation(job.billingPeriod(), company.getRazaoSocial(),
                        direction);
                ScanReport report = scanner.scan(table, job.billingPeriod(), location, session, checkpoint,
                        (progress, event) -> onScanProgress(jobId, start, share, progress, event, session));
                reports.add(report);
                record(jobId, summarize(report), snapshot -> snapshot.withProgress(start + share));
            }

            checkpoint.check();
            finish(job, company, reports);
        } catch (JobCancelledException ex) {
            log.info("Job={} cancelled", jobId);
            record(jobId, "Cancelled", snapshot -> terminal(snapshot, JobStatus.CANCELLED, "Cancelled", null));
        } catch (RetrievalException ex) {
            log.error("Job {} failed: {}", jobId, ex.getMessage(), ex);
            String error = "%s: %s".formatted(ex.errorType(), ex.getMessage());
            record(jobId, "Failed: " + error, snapshot -> terminal(snapshot, JobStatus.FAILED, "Failed", error));
        } catch (RuntimeException ex) {
            log.error("Job {} failed unexpectedly: {}", jobId, ex.getMessage(), ex);
            String error = "%s: %s".formatted(ex.getClass().getSimpleName(), ex.getMessage());
            record(jobId, "Failed: " + error, snapshot -> terminal(snapshot, JobStatus.FAILED, "Failed", error));
        }
    }

    private void finish(JobSnapshot job, Company company, List<ScanReport> reports) {
        String jobId = job.jobId();
        record(jobId, "Finalizing", snapshot -> snapshot.toBuilder()
                .stage(JobStage.FINALIZE)
                .message("Writing manifest")
                .build());

        List<Artifact> artifacts = reports.stream().flatMap(report -> report.artifacts().stream()).toList();
        int failures = reports.stream().mapToInt(report -> report.rowFailures().size()).sum();
        long needsReview = reports.stream().mapToLong(ScanReport::artifactsNeedingReview).sum();

        if (!artifacts.isEmpty()) {
            try {
                manifestWriter.write(pathBuilder.companyDirectory(job.billingPeriod(), company.getRazaoSocial()),
                        artifacts, jobId);
            } catch (ArtifactWriteException ex) {
                log.warn("Job {} could not update manifest: {}", jobId, ex.getMessage());
                record(jobId, "Manifest not updated: " + ex.getMessage(), snapshot -> snapshot);
            }
        }

        String message;
        if (reports.stream().allMatch(ScanReport::nothingToDo) && failures == 0) {
            message = "Nothing to do: no valid notes for %s".formatted(job.billingPeriod());
        } else if (failures > 0 || needsReview > 0) {
            message = "Completed with warnings: %d files saved, %d row failures, %d files need review"
                    .formatted(artifacts.size(), failures, needsReview);
        } else {
            message = "Completed: %d files saved".formatted(artifacts.size());
        }
        log.info("Job={} succeeded artifacts={} rowFailures={} needsReview={}", jobId, artifacts.size(), failures,
                needsReview);
        record(jobId, message, snapshot -> terminal(snapshot, JobStatus.SUCCEEDED, message, null).toBuilder()
                .artifactsWritten(artifacts.size())
                .rowFailures(failures)
                .build());
    }

    private void onScanProgress(String jobId, int start, int share, ScanProgress progress, String event,
            PortalSession session) {
        int percent = start + (int) Math.floor(share * progress.fraction());
        String url = session.currentUrl();
        UnaryOperator<JobSnapshot> change = snapshot -> snapshot.toBuilder()
                .currentUrl(url)
                .rowFailures(progress.rowFailures())
                .build()
                .withProgress(percent);
        if (event == null) {
            store.update(jobId, change);
        } else {
            record(jobId, event, change);
        }
    }

    private JobSnapshot terminal(JobSnapshot snapshot, JobStatus status, String message, String error) {
        if (snapshot.status().isTerminal()) {
            return snapshot;
        }
        JobSnapshot.JobSnapshotBuilder builder = snapshot.toBuilder()
                .status(status)
                .message(message)
                .finishedAt(now())
                .lastErrorMessage(error);
        if (status == JobStatus.SUCCEEDED) {
            builder.progressPercent(COMPLETE);
        }
        return builder.build();
    }

    private JobSnapshot record(String jobId, String message, UnaryOperator<JobSnapshot> change) {
        return store.update(jobId, snapshot -> change.apply(snapshot)
                        .withLog(message, now(), zone, automation.getMaxLogEntries()))
                .orElse(null);
    }

    // A login that never reaches the dashboard is an authentication failure.
    private static SessionFacts authenticate(PortalSession session) {
        try {
            return session.authenticate();
        } catch (PortalTimeoutException ex) {
            throw new AuthenticationFailedException("Authentication timed out: " + ex.getMessage(), ex);
        }
    }

    private static String summarize(ScanReport report) {
        return "%s: %d pages, %d rows of the period, %d processed, %d files, %d failures (%s)".formatted(
                report.direction().folderName(),
                report.pagesVisited(),
                report.rowsMatched(),
                report.rowsProcessed(),
                report.artifacts().size(),
                report.rowFailures().size(),
                report.stopReason());
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
