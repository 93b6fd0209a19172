package com.lbg.markets.surveillance.discovery.notify;

import com.lbg.markets.surveillance.discovery.domain.ErrorCategory;
import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import com.lbg.markets.surveillance.discovery.domain.ExecutionStatus;
import com.lbg.markets.surveillance.discovery.domain.ExecutionTrigger;

import java.time.Instant;

/**
 * Lifecycle event of one execution, published for monitoring subscribers.
 */
public record ExecutionEvent(
        String eventType,
        String executionId,
        String tenantId,
        String configurationId,
        ExecutionTrigger trigger,
        ExecutionStatus status,
        Instant occurredAt,
        String resolvedPath,
        String resolvedNamePattern,
        int filesFound,
        int filesProcessed,
        int notificationsEmitted,
        int retryCount,
        ErrorCategory errorCategory,
        String errorMessage,
        Long durationMillis
) {
    public static final String STARTED = "ExecutionStarted";
    public static final String COMPLETED = "ExecutionCompleted";
    public static final String FAILED = "ExecutionFailed";

    public static ExecutionEvent of(ExecutionRecord record, Instant occurredAt) {
        String type;
        switch (record.status()) {
            case COMPLETED:
                type = COMPLETED;
                break;
            case FAILED:
                type = FAILED;
                break;
            default:
                type = STARTED;
                break;
        }
        Long duration = record.completedAt() != null ? record.duration().toMillis() : null;
        return new ExecutionEvent(type, record.executionId(), record.tenantId(), record.configurationId(),
                record.trigger(), record.status(), occurredAt, record.resolvedPath(),
                record.resolvedNamePattern(), record.counts().filesFound(), record.counts().filesProcessed(),
                record.counts().notificationsEmitted(), record.counts().retryCount(),
                record.errorCategory(), record.errorMessage(), duration);
    }
}
