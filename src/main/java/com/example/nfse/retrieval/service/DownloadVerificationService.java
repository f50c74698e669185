package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.model.BillingPeriod;
import com.example.nfse.retrieval.model.Company;
import com.example.nfse.retrieval.model.DetectedExtension;
import com.example.nfse.retrieval.model.Direction;
import com.example.nfse.retrieval.model.DirectionFilter;
import com.example.nfse.retrieval.model.DownloadVerificationReport;
import com.example.nfse.retrieval.model.ValidationVerdict;
import com.example.nfse.retrieval.model.VerifiedFile;
import com.example.nfse.retrieval.support.RetrievalException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Re-validates what a period's runs left on disk for one company. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadVerificationService {

    private final CompanyDirectory companies;
    private final PathBuilder pathBuilder;
    private final ArtifactValidator validator;

    public DownloadVerificationReport verify(String companyIdentifier, String competencia, String tipo) {
        BillingPeriod period = BillingPeriod.parse(competencia);
        DirectionFilter filter = DirectionFilter.fromWire(tipo);
        Company company = companies.resolve(companyIdentifier);

        List<VerifiedFile> files = new ArrayList<>();
        int xml = 0;
        int pdf = 0;
        int review = 0;
        int invalid = 0;
        for (Direction direction : filter.directions()) {
            for (Path file : list(pathBuilder.resolve(period, company.getRazaoSocial(), direction))) {
                ValidationVerdict verdict = validator.validate(file, direction);
                Optional<DetectedExtension> extension = DetectedExtension.fromFileName(file.getFileName().toString());
                if (extension.isEmpty() || extension.get() == DetectedExtension.BIN) {
                    review++;
                } else if (!verdict.valid()) {
                    invalid++;
                } else if (extension.get() == DetectedExtension.XML) {
                    xml++;
                } else {
                    pdf++;
                }
                files.add(new VerifiedFile(pathBuilder.relativize(file), direction.wireValue(), sizeOf(file),
                        verdict.valid(), verdict.reason()));
            }
        }

        String directory = pathBuilder.relativize(pathBuilder.companyDirectory(period, company.getRazaoSocial()));
        log.info("Verified downloads company={} period={} xml={} pdf={} review={} invalid={}",
                company.getId(), period.compact(), xml, pdf, review, invalid);
        return new DownloadVerificationReport(company.getId(), period.compact(), directory, xml, pdf, review,
                invalid, files);
    }

    private static List<Path> list(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException ex) {
            throw new RetrievalException("Failed to list %s".formatted(directory), ex);
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException ex) {
            log.warn("Cannot read size of {}: {}", file, ex.getMessage());
            return -1;
        }
    }
}
