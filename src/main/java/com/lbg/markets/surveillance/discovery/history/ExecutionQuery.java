package com.lbg.markets.surveillance.discovery.history;

import com.lbg.markets.surveillance.discovery.domain.ExecutionStatus;

import java.time.Instant;

/**
 * Filters over one tenant's executions, newest first. Null filters match everything;
 * {@code from} is inclusive and {@code to} exclusive on the creation time.
 */
public record ExecutionQuery(
        String tenantId,
        String configurationId,
        ExecutionStatus status,
        Instant from,
        Instant to,
        int pageSize,
        String continuationToken
) {
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 500;

    public ExecutionQuery {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be blank");
        }
        if (from != null && to != null && !from.isBefore(to)) {
            throw new IllegalArgumentException("Query window start must be before its end");
        }
        if (pageSize <= 0) {
            pageSize = DEFAULT_PAGE_SIZE;
        }
        pageSize = Math.min(pageSize, MAX_PAGE_SIZE);
    }

    public static ExecutionQuery forConfiguration(String tenantId, String configurationId) {
        return new ExecutionQuery(tenantId, configurationId, null, null, null, DEFAULT_PAGE_SIZE, null);
    }

    public ExecutionQuery next(String token) {
        return new ExecutionQuery(tenantId, configurationId, status, from, to, pageSize, token);
    }
}
