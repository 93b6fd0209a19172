package com.lbg.markets.surveillance.discovery.domain;

import java.time.Instant;

/**
 * A remote file found by one listing call. Never persisted on its own.
 */
public record DiscoveredFile(
        String filename,
        String locator,
        long sizeBytes,
        Instant lastModified,
        Instant discoveredAt
) {
    public DiscoveredFile {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename cannot be blank");
        }
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator cannot be blank");
        }
        if (sizeBytes < 0) {
            sizeBytes = -1;
        }
    }
}
