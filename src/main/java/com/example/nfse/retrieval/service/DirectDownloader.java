package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.config.PortalProperties;
import com.example.nfse.retrieval.model.Artifact;
import com.example.nfse.retrieval.model.ArtifactLocation;
import com.example.nfse.retrieval.model.DetectedExtension;
import com.example.nfse.retrieval.model.DocumentCategory;
import com.example.nfse.retrieval.model.DownloadTarget;
import com.example.nfse.retrieval.model.ValidationVerdict;
import com.example.nfse.retrieval.portal.SessionContext;
import com.example.nfse.retrieval.portal.SessionResponse;
import com.example.nfse.retrieval.support.ArtifactWriteException;
import com.example.nfse.retrieval.support.CompressionSupport;
import com.example.nfse.retrieval.support.ContentClassifier;
import com.example.nfse.retrieval.support.DownloadHttpException;
import com.example.nfse.retrieval.support.RetrievalException;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Replays a resolved link as a plain GET through the authenticated session
 * and writes the body to its final place. The file is flushed to disk before
 * the artifact is returned.
 */
@Slf4j
@Component
public class DirectDownloader {

    private final PathBuilder pathBuilder;
    private final ArtifactValidator validator;
    private final ContentClassifier classifier;
    private final CompressionSupport compressionSupport;
    private final Duration timeout;
    private final Clock clock;

    @Autowired
    public DirectDownloader(PathBuilder pathBuilder,
            ArtifactValidator validator,
            ContentClassifier classifier,
            CompressionSupport compressionSupport,
            PortalProperties portal) {
        this(pathBuilder, validator, classifier, compressionSupport, portal.getDownloadTimeout(), Clock.systemUTC());
    }

    DirectDownloader(PathBuilder pathBuilder,
            ArtifactValidator validator,
            ContentClassifier classifier,
            CompressionSupport compressionSupport,
            Duration timeout,
            Clock clock) {
        this.pathBuilder = pathBuilder;
        this.validator = validator;
        this.classifier = classifier;
        this.compressionSupport = compressionSupport;
        this.timeout = timeout;
        this.clock = clock;
    }

    /** Resolves {@code link} against the page it was found on and derives the document key from it. */
    public DownloadTarget target(ResolvedLink link, DocumentCategory category, String pageUrl) {
        URI resolved;
        try {
            URI reference = URI.create(link.reference().trim().replace(" ", "%20"));
            resolved = pageUrl == null || pageUrl.isBlank() ? reference : URI.create(pageUrl).resolve(reference);
        } catch (IllegalArgumentException ex) {
            throw new RetrievalException("Malformed %s link '%s'".formatted(category.label(), link.reference()), ex);
        }
        return new DownloadTarget(documentKey(resolved), category, resolved.toString());
    }

    public Artifact fetch(DownloadTarget target, SessionContext session, ArtifactLocation location) {
        String url = target.resolvedReference();
        SessionResponse response = session.get(URI.create(url), timeout);
        if (!response.isSuccess()) {
            throw new DownloadHttpException(response.status(), url);
        }

        byte[] body = compressionSupport.decodeIfNecessary(response.body(), response.headers(), url);
        DetectedExtension extension = classifier.classify(response.headers(), body);
        if (extension == DetectedExtension.BIN) {
            log.warn("Inconclusive content for key={} category={} url={}, stored as .bin for review",
                    target.documentKey(), target.category().label(), url);
        }

        Path directory = pathBuilder.resolve(location.billingPeriod(), location.companyName(), location.direction());
        Path file = directory.resolve(pathBuilder.buildFileName(target.documentKey(), target.category(), extension));
        write(file, body);

        ValidationVerdict verdict = validator.validate(file, location.direction());
        if (!verdict.valid()) {
            log.warn("ValidationFailed file={} reason={}", pathBuilder.relativize(file), verdict.reason());
        }
        log.info("Saved {} key={} bytes={} file={}", target.category().label(), target.documentKey(), body.length,
                pathBuilder.relativize(file));
        return new Artifact(
                file,
                body.length,
                extension,
                location.direction().folderName(),
                target.documentKey(),
                target.category(),
                Instant.now(clock),
                verdict);
    }

    static String documentKey(URI uri) {
        String path = uri.getPath();
        if (path == null) {
            return PathBuilder.EMPTY_DOCUMENT_KEY;
        }
        String[] segments = path.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isBlank()) {
                return segments[i];
            }
        }
        return PathBuilder.EMPTY_DOCUMENT_KEY;
    }

    private static void write(Path file, byte[] body) {
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(body);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
        } catch (IOException ex) {
            throw new ArtifactWriteException("Failed to write %s".formatted(file), ex);
        }
    }
}
