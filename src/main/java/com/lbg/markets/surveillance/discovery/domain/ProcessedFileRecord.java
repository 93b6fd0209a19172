package com.lbg.markets.surveillance.discovery.domain;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Dedup ledger entry: the first execution to claim a file on a given discovery date.
 */
public record ProcessedFileRecord(
        String recordId,
        String tenantId,
        String configurationId,
        String executionId,
        String filename,
        String locator,
        LocalDate discoveryDate,
        long sizeBytes,
        Instant processedAt
) {
    public ProcessedFileRecord {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("recordId cannot be blank");
        }
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator cannot be blank");
        }
        if (discoveryDate == null) {
            throw new IllegalArgumentException("discoveryDate is required");
        }
    }
}
