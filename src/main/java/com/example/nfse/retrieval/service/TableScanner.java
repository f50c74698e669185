package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.config.AutomationProperties;
import com.example.nfse.retrieval.config.PortalProperties;
import com.example.nfse.retrieval.model.Artifact;
import com.example.nfse.retrieval.model.ArtifactLocation;
import com.example.nfse.retrieval.model.BillingPeriod;
import com.example.nfse.retrieval.model.Direction;
import com.example.nfse.retrieval.model.DocumentCategory;
import com.example.nfse.retrieval.model.DownloadTarget;
import com.example.nfse.retrieval.model.NoteRow;
import com.example.nfse.retrieval.model.RowFailure;
import com.example.nfse.retrieval.model.ScanProgress;
import com.example.nfse.retrieval.model.ScanReport;
import com.example.nfse.retrieval.portal.PortalTable;
import com.example.nfse.retrieval.portal.SessionContext;
import com.example.nfse.retrieval.support.DownloadHttpException;
import com.example.nfse.retrieval.support.JobCancelledException;
import com.example.nfse.retrieval.support.JobTimeoutException;
import com.example.nfse.retrieval.support.PortalTimeoutException;
import com.example.nfse.retrieval.support.RetrievalException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Walks the paginated notes table of one direction and downloads the primary
 * and companion documents of every valid row of the billing period.
 *
 * <p>Pages are visited while the last row of the current page still belongs
 * to the period. The scan also stops on a page without matches once an
 * earlier page had some, and when the pager has no next page. Row failures
 * are collected in the report and never abort the scan; only cancellation and
 * the job deadline do.
 */
@Slf4j
@Component
public class TableScanner {

    static final String STOP_NO_ROWS = "table rendered no rows";
    static final String STOP_PERIOD_ENDED = "last row of page is outside the period";
    static final String STOP_NO_MATCHES = "page without matches after matching pages";
    static final String STOP_LAST_PAGE = "no next page";
    static final String STOP_PAGER_FAILED = "could not advance to the next page";

    private final LinkResolver linkResolver;
    private final DirectDownloader downloader;
    private final RowValidity rowValidity;
    private final int periodColumn;
    private final int maxAttempts;

    @Autowired
    public TableScanner(LinkResolver linkResolver,
            DirectDownloader downloader,
            RowValidity rowValidity,
            PortalProperties portal,
            AutomationProperties automation) {
        this(linkResolver, downloader, rowValidity, portal.getPeriodColumn(), automation.getMaxRetriesPerStep());
    }

    TableScanner(LinkResolver linkResolver,
            DirectDownloader downloader,
            RowValidity rowValidity,
            int periodColumn,
            int maxAttempts) {
        this.linkResolver = linkResolver;
        this.downloader = downloader;
        this.rowValidity = rowValidity;
        this.periodColumn = periodColumn;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    ScanReport scan(PortalTable table,
            BillingPeriod period,
            ArtifactLocation location,
            SessionContext session,
            Checkpoint checkpoint,
            ScanProgressListener listener) {
        Direction direction = location.direction();
        ScanAccumulator accumulator = new ScanAccumulator(direction, listener);

        checkpoint.check();
        if (!table.awaitRows()) {
            accumulator.event("%s: no notes listed".formatted(direction.folderName()));
            return accumulator.toReport(STOP_NO_ROWS);
        }

        boolean matchedBefore = false;
        while (true) {
            accumulator.nextPage();
            int rowCount = table.rowCount();
            accumulator.rowsLoaded(rowCount);
            int pageMatches = 0;
            boolean lastRowMatched = false;

            for (int index = 0; index < rowCount; index++) {
                checkpoint.check();
                lastRowMatched = false;
                try {
                    NoteRow note;
                    try {
                        note = toNoteRow(index, table.row(index));
                    } catch (JobCancelledException | JobTimeoutException ex) {
                        throw ex;
                    } catch (RetrievalException ex) {
                        accumulator.failure(index, DocumentCategory.PRIMARY, ex);
                        continue;
                    }

                    accumulator.examined();
                    if (!period.matches(note.billingPeriodText())) {
                        continue;
                    }
                    lastRowMatched = true;
                    pageMatches++;
                    accumulator.matched();

                    if (!note.valid()) {
                        accumulator.skippedInvalid(index);
                        continue;
                    }
                    processRow(table, index, location, session, checkpoint, accumulator);
                } finally {
                    accumulator.rowDone();
                }
            }

            if (pageMatches == 0 && matchedBefore) {
                return accumulator.toReport(STOP_NO_MATCHES);
            }
            matchedBefore |= pageMatches > 0;
            if (!lastRowMatched) {
                return accumulator.toReport(STOP_PERIOD_ENDED);
            }

            checkpoint.check();
            try {
                if (!table.nextPage()) {
                    return accumulator.toReport(STOP_LAST_PAGE);
                }
            } catch (JobCancelledException | JobTimeoutException ex) {
                throw ex;
            } catch (RetrievalException ex) {
                log.warn("Pager failed on {} page {}: {}", direction.folderName(), accumulator.page, ex.getMessage());
                return accumulator.toReport(STOP_PAGER_FAILED);
            }
            if (!table.awaitRows()) {
                return accumulator.toReport(STOP_PAGER_FAILED);
            }
        }
    }

    NoteRow toNoteRow(int index, Element row) {
        List<Element> cells = cells(row);
        String periodText = periodColumn < cells.size() ? cells.get(periodColumn).text().trim() : "";
        return new NoteRow(index, periodText, rowValidity.isValid(row));
    }

    static List<Element> cells(Element row) {
        List<Element> cells = new ArrayList<>();
        for (Element child : row.children()) {
            if ("td".equals(child.normalName())) {
                cells.add(child);
            }
        }
        return cells;
    }

    private void processRow(PortalTable table,
            int index,
            ArtifactLocation location,
            SessionContext session,
            Checkpoint checkpoint,
            ScanAccumulator accumulator) {
        Element menuRow;
        try {
            menuRow = withRetry(checkpoint, () -> table.openActionMenu(index));
        } catch (JobCancelledException | JobTimeoutException ex) {
            throw ex;
        } catch (RetrievalException ex) {
            accumulator.failure(index, DocumentCategory.PRIMARY, ex);
            return;
        }

        Map<DocumentCategory, DownloadTarget> targets = new EnumMap<>(DocumentCategory.class);
        for (DocumentCategory category : DocumentCategory.values()) {
            try {
                ResolvedLink link = linkResolver.resolve(menuRow, category);
                targets.put(category, downloader.target(link, category, session.currentUrl()));
            } catch (RetrievalException ex) {
                accumulator.failure(index, category, ex);
            }
        }
        if (targets.isEmpty()) {
            return;
        }

        String documentKey = targets.values().iterator().next().documentKey();
        if (!accumulator.firstSighting(documentKey)) {
            accumulator.skippedDuplicate(index, documentKey);
            return;
        }

        accumulator.processed();
        for (DownloadTarget target : targets.values()) {
            checkpoint.check();
            try {
                Artifact artifact = withRetry(checkpoint, () -> downloader.fetch(target, session, location));
                accumulator.artifact(index, artifact);
            } catch (JobCancelledException | JobTimeoutException ex) {
                throw ex;
            } catch (RetrievalException ex) {
                accumulator.failure(index, target.category(), ex);
            }
        }
    }

    private <T> T withRetry(Checkpoint checkpoint, Supplier<T> step) {
        RetrievalException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return step.get();
            } catch (JobCancelledException | JobTimeoutException ex) {
                throw ex;
            } catch (RetrievalException ex) {
                if (!isRecoverable(ex)) {
                    throw ex;
                }
                last = ex;
                log.debug("Attempt {}/{} failed: {}", attempt, maxAttempts, ex.getMessage());
                checkpoint.check();
            }
        }
        throw last;
    }

    private static boolean isRecoverable(RetrievalException ex) {
        if (ex instanceof PortalTimeoutException) {
            return true;
        }
        if (ex instanceof DownloadHttpException http) {
            return http.getStatus() >= 500 || http.getStatus() == 429;
        }
        return false;
    }

    private static final class ScanAccumulator {
        private final Direction direction;
        private final ScanProgressListener listener;
        private final Set<String> seenKeys = new HashSet<>();
        private final List<Artifact> artifacts = new ArrayList<>();
        private final List<RowFailure> failures = new ArrayList<>();

        private int page;
        private int rowsSeen;
        private int examined;
        private int matched;
        private int skippedInvalid;
        private int skippedDuplicate;
        private int processed;

        private ScanAccumulator(Direction direction, ScanProgressListener listener) {
            this.direction = direction;
            this.listener = listener;
        }

        void nextPage() {
            page++;
        }

        void rowsLoaded(int count) {
            rowsSeen += count;
        }

        void examined() {
            examined++;
        }

        void rowDone() {
            report(null);
        }

        void matched() {
            matched++;
        }

        void processed() {
            processed++;
        }

        boolean firstSighting(String documentKey) {
            return seenKeys.add(documentKey);
        }

        void skippedInvalid(int index) {
            skippedInvalid++;
            event("%s page %d row %d: cancelled or invalid note, skipped".formatted(
                    direction.folderName(), page, index + 1));
        }

        void skippedDuplicate(int index, String documentKey) {
            skippedDuplicate++;
            event("%s page %d row %d: %s already retrieved in this scan".formatted(
                    direction.folderName(), page, index + 1, documentKey));
        }

        void artifact(int index, Artifact artifact) {
            artifacts.add(artifact);
            String suffix = artifact.verdict().valid() ? "" : " (needs review: %s)".formatted(artifact.verdict().reason());
            event("%s page %d row %d: saved %s %s.%s%s".formatted(direction.folderName(), page, index + 1,
                    artifact.category().label(), artifact.documentKey(), artifact.detectedExtension().suffix(),
                    suffix));
        }

        void failure(int index, DocumentCategory category, RetrievalException ex) {
            RowFailure failure = new RowFailure(page, index, category, ex.errorType(), ex.getMessage());
            failures.add(failure);
            log.warn("Row failure direction={} {}", direction.folderName(), failure.describe());
            event("%s %s".formatted(direction.folderName(), failure.describe()));
        }

        void event(String message) {
            report(message);
        }

        ScanReport toReport(String stopReason) {
            log.info("Scan finished direction={} pages={} examined={} matched={} processed={} invalid={} "
                    + "duplicates={} artifacts={} failures={} stop='{}'",
                    direction.folderName(), page, examined, matched, processed, skippedInvalid, skippedDuplicate,
                    artifacts.size(), failures.size(), stopReason);
            return new ScanReport(direction, page, examined, matched, skippedInvalid, skippedDuplicate, processed,
                    artifacts, failures, stopReason);
        }

        private void report(String message) {
            if (listener == null) {
                return;
            }
            listener.onProgress(new ScanProgress(direction, page, rowsSeen, examined, processed, failures.size()),
                    message);
        }
    }
}
