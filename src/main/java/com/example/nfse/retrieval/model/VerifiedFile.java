package com.example.nfse.retrieval.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VerifiedFile(
        @JsonProperty("arquivo") String relativePath,
        @JsonProperty("tipo") String direction,
        @JsonProperty("tamanho") long byteSize,
        @JsonProperty("valido") boolean valid,
        @JsonProperty("motivo") String reason) {
}
