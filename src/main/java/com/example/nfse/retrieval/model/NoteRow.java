package com.example.nfse.retrieval.model;

public record NoteRow(int rowIndex, String billingPeriodText, boolean valid) {
}
