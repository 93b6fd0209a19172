package com.lbg.markets.surveillance.discovery.notify;

import com.lbg.markets.surveillance.discovery.domain.DiscoveredFile;
import com.lbg.markets.surveillance.discovery.domain.NotificationTarget;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;
import com.lbg.markets.surveillance.discovery.util.IdempotencyKeys;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the notification for one target and one file. String values of the target's
 * static payload may reference {filename}, {locator}, {size} and {configurationId}.
 */
@ApplicationScoped
public class NotificationFactory {

    public FileDiscoveredNotification create(RetrievalConfiguration config, String executionId,
                                             NotificationTarget target, DiscoveredFile file,
                                             LocalDate discoveryDate) {
        String fileKey = IdempotencyKeys.forFile(config.tenantId(), config.configurationId(),
                file.locator(), discoveryDate);
        String idempotencyKey = IdempotencyKeys.forTarget(fileKey, target.mode());

        return new FileDiscoveredNotification(
                IdempotencyKeys.messageId(idempotencyKey, target.typeName()),
                idempotencyKey,
                target.typeName(),
                target.mode(),
                config.tenantId(),
                config.configurationId(),
                config.name(),
                executionId,
                config.protocol(),
                file.filename(),
                file.locator(),
                file.sizeBytes(),
                file.lastModified(),
                discoveryDate,
                file.discoveredAt(),
                substitute(target.payload(), config, file)
        );
    }

    static Map<String, Object> substitute(Map<String, Object> payload, RetrievalConfiguration config,
                                          DiscoveredFile file) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : payload.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String) {
                value = ((String) value)
                        .replace("{filename}", file.filename())
                        .replace("{locator}", file.locator())
                        .replace("{size}", String.valueOf(file.sizeBytes()))
                        .replace("{configurationId}", config.configurationId());
            }
            data.put(entry.getKey(), value);
        }
        return data;
    }
}
