package com.example.nfse.retrieval.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiError(
        @JsonProperty("erro") String errorType,
        @JsonProperty("detalhe") String detail) {
}
