package com.example.nfse.retrieval.model;

import java.util.List;

public record ScanReport(
        Direction direction,
        int pagesVisited,
        int rowsExamined,
        int rowsMatched,
        int rowsSkippedInvalid,
        int rowsSkippedDuplicate,
        int rowsProcessed,
        List<Artifact> artifacts,
        List<RowFailure> rowFailures,
        String stopReason) {

    public ScanReport {
        artifacts = List.copyOf(artifacts);
        rowFailures = List.copyOf(rowFailures);
    }

    /** No row of the period was eligible for download. */
    public boolean nothingToDo() {
        return rowsProcessed == 0;
    }

    public long artifactsNeedingReview() {
        return artifacts.stream().filter(Artifact::needsReview).count();
    }
}
