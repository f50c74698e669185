package com.example.nfse.retrieval.model;

public enum CompanyRegime {
    MEI,
    SIMPLES,
    PRESUMIDO
}
