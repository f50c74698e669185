package com.example.nfse.retrieval.model;

/** Where the artifacts of one scan land: period, company folder and direction folder. */
public record ArtifactLocation(BillingPeriod billingPeriod, String companyName, Direction direction) {
}
