package com.lbg.markets.surveillance.discovery.history;

import com.lbg.markets.surveillance.discovery.domain.ConfigKey;
import com.lbg.markets.surveillance.discovery.domain.ErrorCategory;
import com.lbg.markets.surveillance.discovery.domain.ExecutionCounts;
import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import com.lbg.markets.surveillance.discovery.domain.ExecutionTrigger;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionMetricsAggregationTest {

    private static final ConfigKey KEY = new ConfigKey("acme", "daily-trades");
    private static final Instant FROM = Instant.parse("2026-02-20T00:00:00Z");
    private static final Instant TO = Instant.parse("2026-02-23T00:00:00Z");

    private static ExecutionRecord started(String id, String createdAt) {
        Instant created = Instant.parse(createdAt);
        return ExecutionRecord.pending(id, KEY, ExecutionTrigger.SCHEDULED, created, created.plusSeconds(600))
                .running(created);
    }

    @Test
    void shouldAggregateOutcomesAndCounters() {
        ExecutionRecord ok = started("e1", "2026-02-20T06:00:00Z")
                .completed(Instant.parse("2026-02-20T06:00:02Z"), new ExecutionCounts(3, 2, 4, 0));
        ExecutionRecord okToo = started("e2", "2026-02-21T06:00:00Z")
                .completed(Instant.parse("2026-02-21T06:00:04Z"), new ExecutionCounts(1, 1, 2, 1));
        ExecutionRecord failed = started("e3", "2026-02-21T07:00:00Z")
                .failed(Instant.parse("2026-02-21T07:00:06Z"), new ExecutionCounts(0, 0, 0, 2),
                        ErrorCategory.NETWORK_ERROR, "timeout");
        ExecutionRecord running = started("e4", "2026-02-22T06:00:00Z");

        ExecutionMetrics metrics = ExecutionHistoryService.aggregate(List.of(ok, okToo, failed, running), FROM, TO);

        assertEquals(4, metrics.totalExecutions());
        assertEquals(2, metrics.completed());
        assertEquals(1, metrics.failed());
        assertEquals(1, metrics.inProgress());
        assertEquals(2.0 / 3.0, metrics.successRate(), 1e-9);
        assertEquals(Duration.ofSeconds(4), metrics.averageDuration());
        assertEquals(4, metrics.filesFound());
        assertEquals(3, metrics.filesProcessed());
        assertEquals(6, metrics.notificationsEmitted());
        assertEquals(3L, metrics.filesDiscoveredPerDay().get(LocalDate.of(2026, 2, 20)));
        assertEquals(1L, metrics.filesDiscoveredPerDay().get(LocalDate.of(2026, 2, 21)));
        assertEquals(1L, metrics.failuresByCategory().get(ErrorCategory.NETWORK_ERROR));
    }

    @Test
    void shouldReportZeroRateForEmptyWindow() {
        ExecutionMetrics metrics = ExecutionHistoryService.aggregate(List.of(), FROM, TO);

        assertEquals(0, metrics.totalExecutions());
        assertEquals(0.0, metrics.successRate());
        assertEquals(Duration.ZERO, metrics.averageDuration());
        assertTrue(metrics.failuresByCategory().isEmpty());
    }
}
