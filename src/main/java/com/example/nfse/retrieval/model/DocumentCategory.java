package com.example.nfse.retrieval.model;

public enum DocumentCategory {
    PRIMARY("primary", DetectedExtension.XML),
    COMPANION("companion", DetectedExtension.PDF);

    private final String label;
    private final DetectedExtension expectedExtension;

    DocumentCategory(String label, DetectedExtension expectedExtension) {
        this.label = label;
        this.expectedExtension = expectedExtension;
    }

    public String label() {
        return label;
    }

    public DetectedExtension expectedExtension() {
        return expectedExtension;
    }
}
