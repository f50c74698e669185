package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.config.AutomationProperties;
import com.example.nfse.retrieval.model.DetectedExtension;
import com.example.nfse.retrieval.model.Direction;
import com.example.nfse.retrieval.model.ValidationVerdict;
import com.example.nfse.retrieval.support.ContentClassifier;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Checks a written artifact: present, above the minimum size, a recognised
 * extension whose leading bytes agree with it, and stored under the
 * direction folder it was fetched for.
 */
@Slf4j
@Component
public class ArtifactValidator {

    private static final int SIGNATURE_BYTES = 512;

    private final ContentClassifier classifier;
    private final long minBytes;

    @Autowired
    public ArtifactValidator(ContentClassifier classifier, AutomationProperties properties) {
        this(classifier, properties.getMinArtifactBytes());
    }

    ArtifactValidator(ContentClassifier classifier, long minBytes) {
        this.classifier = classifier;
        this.minBytes = Math.max(1, minBytes);
    }

    public ValidationVerdict validate(Path file, Direction expectedDirection) {
        if (file == null || !Files.isRegularFile(file)) {
            return ValidationVerdict.failed("file does not exist");
        }

        long size;
        try {
            size = Files.size(file);
        } catch (IOException ex) {
            log.warn("Cannot read size of {}: {}", file, ex.getMessage());
            return ValidationVerdict.failed("unreadable: " + ex.getMessage());
        }
        if (size < minBytes) {
            return ValidationVerdict.failed("too small (%d bytes, minimum %d)".formatted(size, minBytes));
        }

        String parent = file.getParent() == null || file.getParent().getFileName() == null
                ? ""
                : file.getParent().getFileName().toString();
        if (!Direction.isFolderName(parent)) {
            return ValidationVerdict.failed("parent folder '%s' is not Emitidas or Recebidas".formatted(parent));
        }
        if (expectedDirection != null && !expectedDirection.folderName().equals(parent)) {
            return ValidationVerdict.failed("stored under %s, expected %s".formatted(parent,
                    expectedDirection.folderName()));
        }

        Optional<DetectedExtension> extension = DetectedExtension.fromFileName(file.getFileName().toString());
        if (extension.isEmpty()) {
            return ValidationVerdict.failed("unrecognised extension");
        }
        if (extension.get() == DetectedExtension.BIN) {
            return ValidationVerdict.failed("inconclusive content type, needs operator review");
        }

        DetectedExtension sniffed;
        try (InputStream in = Files.newInputStream(file)) {
            sniffed = classifier.sniff(in.readNBytes(SIGNATURE_BYTES));
        } catch (IOException ex) {
            log.warn("Cannot read signature of {}: {}", file, ex.getMessage());
            return ValidationVerdict.failed("unreadable: " + ex.getMessage());
        }
        if (sniffed != extension.get()) {
            return ValidationVerdict.failed("content looks like %s, not %s".formatted(sniffed.suffix(),
                    extension.get().suffix()));
        }
        return ValidationVerdict.passed();
    }
}
