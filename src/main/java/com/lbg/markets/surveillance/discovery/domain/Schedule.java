package com.lbg.markets.surveillance.discovery.domain;

import java.time.ZoneId;

/**
 * Five-field cron expression evaluated in an IANA time zone.
 */
public record Schedule(String cronExpression, String zoneId) {
    public Schedule {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new IllegalArgumentException("cronExpression cannot be blank");
        }
        if (zoneId == null || zoneId.isBlank()) {
            zoneId = "UTC";
        }
        cronExpression = cronExpression.trim();
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }
}
