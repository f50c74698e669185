package com.example.nfse.retrieval.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CompanyRequest(
        String cnpj,
        @JsonProperty("razao_social") String razaoSocial,
        CompanyRegime regime) {
}
