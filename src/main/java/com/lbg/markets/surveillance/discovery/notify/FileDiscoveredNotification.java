package com.lbg.markets.surveillance.discovery.notify;

import com.lbg.markets.surveillance.discovery.domain.DeliveryMode;
import com.lbg.markets.surveillance.discovery.domain.ProtocolType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Body of every notification or command emitted for a newly discovered file.
 * Consumers deduplicate on {@code idempotencyKey}; {@code messageId} is stable across redeliveries.
 */
public record FileDiscoveredNotification(
        String messageId,
        String idempotencyKey,
        String typeName,
        DeliveryMode mode,
        String tenantId,
        String configurationId,
        String configurationName,
        String executionId,
        ProtocolType protocol,
        String filename,
        String locator,
        long sizeBytes,
        Instant lastModified,
        LocalDate discoveryDate,
        Instant discoveredAt,
        Map<String, Object> data
) {
    public FileDiscoveredNotification {
        data = data != null ? Map.copyOf(data) : Map.of();
    }
}
