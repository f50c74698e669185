package com.example.nfse.retrieval.model;

import java.nio.file.Path;
import java.time.Instant;

public record Artifact(
        Path absolutePath,
        long byteSize,
        DetectedExtension detectedExtension,
        String parentFolderName,
        String documentKey,
        DocumentCategory category,
        Instant writtenAt,
        ValidationVerdict verdict) {

    public boolean needsReview() {
        return detectedExtension == DetectedExtension.BIN || !verdict.valid();
    }
}
