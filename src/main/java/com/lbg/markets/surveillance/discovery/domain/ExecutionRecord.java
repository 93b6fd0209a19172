package com.lbg.markets.surveillance.discovery.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * One discovery cycle attempt for one configuration.
 * Moves PENDING → RUNNING → COMPLETED | FAILED and is never changed once terminal.
 */
public record ExecutionRecord(
        String executionId,
        String tenantId,
        String configurationId,
        ExecutionTrigger trigger,
        ExecutionStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant deadline,
        ExecutionCounts counts,
        String resolvedPath,
        String resolvedNamePattern,
        ErrorCategory errorCategory,
        String errorMessage
) {
    public static final int MAX_ERROR_MESSAGE_LENGTH = 5000;

    public ExecutionRecord {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId cannot be blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt is required");
        }
        if (counts == null) {
            counts = ExecutionCounts.NONE;
        }
        if (trigger == null) {
            trigger = ExecutionTrigger.SCHEDULED;
        }
        if (errorMessage != null && errorMessage.length() > MAX_ERROR_MESSAGE_LENGTH) {
            errorMessage = errorMessage.substring(0, MAX_ERROR_MESSAGE_LENGTH);
        }
    }

    public static ExecutionRecord pending(String executionId, ConfigKey key, ExecutionTrigger trigger,
                                          Instant createdAt, Instant deadline) {
        return new ExecutionRecord(executionId, key.tenantId(), key.configurationId(), trigger,
                ExecutionStatus.PENDING, createdAt, null, null, deadline, ExecutionCounts.NONE,
                null, null, null, null);
    }

    public ConfigKey key() {
        return new ConfigKey(tenantId, configurationId);
    }

    public ExecutionRecord running(Instant at) {
        requireStatus(ExecutionStatus.PENDING);
        return new ExecutionRecord(executionId, tenantId, configurationId, trigger, ExecutionStatus.RUNNING,
                createdAt, at, null, deadline, counts, resolvedPath, resolvedNamePattern, null, null);
    }

    public ExecutionRecord resolved(String path, String namePattern) {
        requireStatus(ExecutionStatus.RUNNING);
        return new ExecutionRecord(executionId, tenantId, configurationId, trigger, status,
                createdAt, startedAt, null, deadline, counts, path, namePattern, null, null);
    }

    public ExecutionRecord completed(Instant at, ExecutionCounts finalCounts) {
        requireNotTerminal();
        return new ExecutionRecord(executionId, tenantId, configurationId, trigger, ExecutionStatus.COMPLETED,
                createdAt, startedAt, at, deadline, finalCounts, resolvedPath, resolvedNamePattern, null, null);
    }

    public ExecutionRecord failed(Instant at, ExecutionCounts finalCounts, ErrorCategory category, String message) {
        requireNotTerminal();
        if (category == null) {
            throw new IllegalArgumentException("A failed execution needs an error category");
        }
        return new ExecutionRecord(executionId, tenantId, configurationId, trigger, ExecutionStatus.FAILED,
                createdAt, startedAt, at, deadline, finalCounts, resolvedPath, resolvedNamePattern,
                category, message);
    }

    /**
     * Wall time from start (or creation, if it never started) to completion; null while not terminal.
     */
    public Duration duration() {
        if (completedAt == null) {
            return null;
        }
        Instant from = startedAt != null ? startedAt : createdAt;
        return Duration.between(from, completedAt);
    }

    private void requireStatus(ExecutionStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Execution " + executionId + " is " + status + ", expected " + expected);
        }
    }

    private void requireNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution " + executionId + " already ended as " + status);
        }
    }
}
