package com.lbg.markets.surveillance.discovery.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionRecordTest {

    private static final ConfigKey KEY = new ConfigKey("acme", "daily-trades");
    private static final Instant CREATED = Instant.parse("2026-02-23T00:00:00Z");

    private ExecutionRecord pending() {
        return ExecutionRecord.pending("exec-1", KEY, ExecutionTrigger.SCHEDULED, CREATED, CREATED.plusSeconds(600));
    }

    @Test
    void shouldMoveThroughLifecycle() {
        ExecutionRecord running = pending().running(CREATED.plusSeconds(1)).resolved("/in/2026", "*.csv");
        ExecutionRecord done = running.completed(CREATED.plusSeconds(4), new ExecutionCounts(2, 1, 1, 0));

        assertEquals(ExecutionStatus.COMPLETED, done.status());
        assertEquals("/in/2026", done.resolvedPath());
        assertEquals(Duration.ofSeconds(3), done.duration());
        assertNull(done.errorCategory());
    }

    @Test
    void shouldNeverChangeOnceTerminal() {
        ExecutionRecord failed = pending().running(CREATED)
                .failed(CREATED.plusSeconds(1), ExecutionCounts.NONE, ErrorCategory.NETWORK_ERROR, "timeout");

        assertThrows(IllegalStateException.class, () -> failed.completed(CREATED.plusSeconds(2), ExecutionCounts.NONE));
        assertThrows(IllegalStateException.class,
                () -> failed.failed(CREATED.plusSeconds(2), ExecutionCounts.NONE, ErrorCategory.CANCELLED, "again"));
        assertThrows(IllegalStateException.class, () -> failed.running(CREATED));
    }

    @Test
    void shouldRequireCategoryOnFailure() {
        ExecutionRecord running = pending().running(CREATED);

        assertThrows(IllegalArgumentException.class,
                () -> running.failed(CREATED, ExecutionCounts.NONE, null, "boom"));
    }

    @Test
    void shouldMeasureFromCreationWhenNeverStarted() {
        ExecutionRecord failed = pending()
                .failed(CREATED.plusSeconds(30), ExecutionCounts.NONE, ErrorCategory.CANCELLED, "saturated");

        assertEquals(Duration.ofSeconds(30), failed.duration());
        assertNull(pending().duration());
    }

    @Test
    void shouldTruncateLongErrorMessages() {
        String longMessage = "x".repeat(ExecutionRecord.MAX_ERROR_MESSAGE_LENGTH + 100);

        ExecutionRecord failed = pending().running(CREATED)
                .failed(CREATED, ExecutionCounts.NONE, ErrorCategory.INTERNAL_ERROR, longMessage);

        assertEquals(ExecutionRecord.MAX_ERROR_MESSAGE_LENGTH, failed.errorMessage().length());
        assertTrue(failed.status().isTerminal());
    }
}
