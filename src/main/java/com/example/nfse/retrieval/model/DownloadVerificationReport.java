package com.example.nfse.retrieval.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record DownloadVerificationReport(
        @JsonProperty("empresa_id") String companyId,
        @JsonProperty("competencia") String billingPeriod,
        @JsonProperty("diretorio") String directory,
        @JsonProperty("total_xml") int xmlCount,
        @JsonProperty("total_pdf") int pdfCount,
        @JsonProperty("total_revisao") int needsReviewCount,
        @JsonProperty("total_invalidos") int invalidCount,
        @JsonProperty("arquivos") List<VerifiedFile> files) {

    public DownloadVerificationReport {
        files = List.copyOf(files);
    }
}
