package com.example.nfse.retrieval.model;

public record DownloadTarget(String documentKey, DocumentCategory category, String resolvedReference) {
}
