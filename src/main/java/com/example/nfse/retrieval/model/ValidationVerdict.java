package com.example.nfse.retrieval.model;

public record ValidationVerdict(boolean valid, String reason) {

    public static final String OK = "ok";

    public static ValidationVerdict passed() {
        return new ValidationVerdict(true, OK);
    }

    public static ValidationVerdict failed(String reason) {
        return new ValidationVerdict(false, reason);
    }
}
