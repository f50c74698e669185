package com.example.nfse.retrieval.service;

public record ResolvedLink(String reference, String strategy) {
}
