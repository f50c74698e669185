package com.example.nfse.retrieval.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record CompanyResponse(
        String id,
        String cnpj,
        @JsonProperty("razao_social") String razaoSocial,
        CompanyRegime regime,
        boolean ativo,
        @JsonProperty("created_at") Instant createdAt) {

    public static CompanyResponse from(Company company) {
        return new CompanyResponse(
                company.getId(),
                company.getCnpj(),
                company.getRazaoSocial(),
                company.getRegime(),
                company.isAtivo(),
                company.getCreatedAt());
    }
}
