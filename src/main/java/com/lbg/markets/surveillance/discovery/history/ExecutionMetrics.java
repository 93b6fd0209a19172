package com.lbg.markets.surveillance.discovery.history;

import com.lbg.markets.surveillance.discovery.domain.ErrorCategory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Aggregates over the executions created in [from, to).
 * {@code successRate} is in [0, 1] and 0 when nothing finished.
 */
public record ExecutionMetrics(
        Instant from,
        Instant to,
        long totalExecutions,
        long completed,
        long failed,
        long inProgress,
        double successRate,
        Duration averageDuration,
        long filesFound,
        long filesProcessed,
        long notificationsEmitted,
        Map<LocalDate, Long> filesDiscoveredPerDay,
        Map<ErrorCategory, Long> failuresByCategory
) {
    public ExecutionMetrics {
        filesDiscoveredPerDay = filesDiscoveredPerDay != null ? Map.copyOf(filesDiscoveredPerDay) : Map.of();
        failuresByCategory = failuresByCategory != null ? Map.copyOf(failuresByCategory) : Map.of();
    }
}
