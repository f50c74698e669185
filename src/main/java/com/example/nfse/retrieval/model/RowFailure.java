package com.example.nfse.retrieval.model;

public record RowFailure(
        int page,
        int rowIndex,
        DocumentCategory category,
        String errorType,
        String message) {

    public String describe() {
        return "page %d row %d %s: %s - %s".formatted(page, rowIndex + 1, category.label(), errorType, message);
    }
}
