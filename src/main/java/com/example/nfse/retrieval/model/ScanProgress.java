package com.example.nfse.retrieval.model;

public record ScanProgress(
        Direction direction,
        int pagesVisited,
        int rowsSeen,
        int rowsExamined,
        int rowsProcessed,
        int rowFailures) {

    /** Fraction of the rows loaded so far that have been examined, capped below 1 until the scan ends. */
    public double fraction() {
        if (rowsSeen == 0) {
            return 0.0;
        }
        return Math.min(0.95, (double) rowsExamined / rowsSeen);
    }
}
