package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.model.Artifact;
import com.example.nfse.retrieval.model.ManifestEntry;
import com.example.nfse.retrieval.support.ArtifactWriteException;
import com.example.nfse.retrieval.support.CamelCsvParserFactory;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keeps {@code manifest.csv} in each company folder: one line per artifact,
 * keyed by its relative path. Re-running a period replaces the lines of the
 * files it rewrote and keeps the rest.
 */
@Slf4j
@Component
public class ManifestWriter {

    static final String FILE_NAME = "manifest.csv";

    private final CamelCsvParserFactory csvFactory;
    private final PathBuilder pathBuilder;

    public ManifestWriter(CamelCsvParserFactory csvFactory, PathBuilder pathBuilder) {
        this.csvFactory = csvFactory;
        this.pathBuilder = pathBuilder;
    }

    public Path write(Path companyDirectory, Collection<Artifact> artifacts, String jobId) {
        Path manifest = companyDirectory.resolve(FILE_NAME);
        Map<String, ManifestEntry> entries = new LinkedHashMap<>();
        try {
            read(manifest).forEach(entry -> entries.put(entry.relativePath(), entry));
        } catch (ArtifactWriteException ex) {
            log.warn("Replacing unreadable manifest {}: {}", manifest, ex.getMessage());
        }
        for (Artifact artifact : artifacts) {
            ManifestEntry entry = toEntry(artifact, jobId);
            entries.put(entry.relativePath(), entry);
        }

        try {
            Files.createDirectories(companyDirectory);
            Path temp = Files.createTempFile(companyDirectory, "manifest-", ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                CsvWriter csvWriter = new CsvWriter(writer, csvFactory.newWriterSettings());
                try {
                    csvWriter.writeHeaders(ManifestEntry.HEADERS);
                    entries.values().forEach(entry -> csvWriter.writeRow((Object[]) entry.toRow()));
                    csvWriter.flush();
                } finally {
                    csvWriter.close();
                }
            }
            Files.move(temp, manifest, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new ArtifactWriteException("Failed to write manifest %s".formatted(manifest), ex);
        }
        log.info("Manifest updated file={} entries={} added={}", pathBuilder.relativize(manifest), entries.size(),
                artifacts.size());
        return manifest;
    }

    public List<ManifestEntry> read(Path manifest) {
        if (!Files.isRegularFile(manifest)) {
            return List.of();
        }
        CsvParser parser = csvFactory.newParser();
        List<ManifestEntry> entries = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(manifest, StandardCharsets.UTF_8)) {
            parser.beginParsing(reader);
            boolean headerSkipped = false;
            String[] row;
            while ((row = parser.parseNext()) != null) {
                if (!headerSkipped) {
                    headerSkipped = true;
                    continue;
                }
                if (row.length < ManifestEntry.HEADERS.length) {
                    log.warn("Skipping malformed manifest line in {}: {} columns", manifest, row.length);
                    continue;
                }
                entries.add(new ManifestEntry(row[0], row[1], row[2], row[3], parseSize(row[4]), row[5], row[6],
                        row[7]));
            }
        } catch (IOException ex) {
            throw new ArtifactWriteException("Failed to read manifest %s".formatted(manifest), ex);
        } catch (TextParsingException ex) {
            throw new ArtifactWriteException("Malformed manifest %s at line %d".formatted(manifest, ex.getLineIndex()),
                    ex);
        } finally {
            parser.stopParsing();
        }
        return entries;
    }

    private ManifestEntry toEntry(Artifact artifact, String jobId) {
        return new ManifestEntry(
                pathBuilder.relativize(artifact.absolutePath()),
                artifact.documentKey(),
                artifact.category().label(),
                artifact.parentFolderName(),
                artifact.byteSize(),
                artifact.verdict().reason(),
                artifact.writtenAt().toString(),
                jobId);
    }

    private static long parseSize(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}
