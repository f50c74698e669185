package com.example.nfse.retrieval.model;

import java.util.Locale;
import java.util.Optional;

public enum DetectedExtension {
    XML,
    PDF,
    BIN;

    public String suffix() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<DetectedExtension> fromFileName(String fileName) {
        int dot = fileName == null ? -1 : fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String suffix = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (DetectedExtension extension : values()) {
            if (extension.suffix().equals(suffix)) {
                return Optional.of(extension);
            }
        }
        return Optional.empty();
    }
}
