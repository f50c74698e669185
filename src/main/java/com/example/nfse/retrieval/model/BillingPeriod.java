package com.example.nfse.retrieval.model;

import com.example.nfse.retrieval.support.InvalidPeriodException;
import java.util.regex.Pattern;

/**
 * Month/year competence a job retrieves documents for. Parsed from the
 * {@code MMYYYY} form used by the API and rendered as {@code MM/YYYY} (portal
 * table text) or {@code MM-YYYY} (folder segment).
 */
public record BillingPeriod(int month, int year) {

    private static final Pattern COMPACT = Pattern.compile("\\d{6}");

    public BillingPeriod {
        if (month < 1 || month > 12) {
            throw new InvalidPeriodException("Month must be between 01 and 12, got %02d".formatted(month));
        }
        if (year < 1000 || year > 9999) {
            throw new InvalidPeriodException("Year must have four digits, got %d".formatted(year));
        }
    }

    public static BillingPeriod parse(String compact) {
        String value = compact == null ? "" : compact.trim();
        if (!COMPACT.matcher(value).matches()) {
            throw new InvalidPeriodException(
                    "Invalid competencia '%s'. Use the MMYYYY format (e.g. 112025)".formatted(compact));
        }
        return new BillingPeriod(Integer.parseInt(value.substring(0, 2)), Integer.parseInt(value.substring(2)));
    }

    public String compact() {
        return "%02d%04d".formatted(month, year);
    }

    public String display() {
        return "%02d/%04d".formatted(month, year);
    }

    public String folderName() {
        return "%02d-%04d".formatted(month, year);
    }

    public boolean matches(String tableText) {
        return tableText != null && display().equals(tableText.trim());
    }

    @Override
    public String toString() {
        return display();
    }
}
