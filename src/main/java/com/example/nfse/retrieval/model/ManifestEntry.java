package com.example.nfse.retrieval.model;

/** One line of a run manifest; {@code relativePath} is the merge key. */
public record ManifestEntry(
        String relativePath,
        String documentKey,
        String category,
        String direction,
        long byteSize,
        String verdict,
        String writtenAt,
        String jobId) {

    public static final String[] HEADERS = {
        "relativePath", "documentKey", "category", "direction", "byteSize", "verdict", "writtenAt", "jobId"
    };

    public String[] toRow() {
        return new String[] {
            relativePath, documentKey, category, direction, Long.toString(byteSize), verdict, writtenAt, jobId
        };
    }
}
