package com.example.nfse.retrieval.portal;

public record SessionFacts(String url, String title) {
}
