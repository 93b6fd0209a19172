package com.lbg.markets.surveillance.discovery.domain;

public record ExecutionCounts(
        int filesFound,
        int filesProcessed,
        int notificationsEmitted,
        int retryCount
) {
    public static final ExecutionCounts NONE = new ExecutionCounts(0, 0, 0, 0);

    public ExecutionCounts {
        if (filesFound < 0 || filesProcessed < 0 || notificationsEmitted < 0 || retryCount < 0) {
            throw new IllegalArgumentException("Execution counts cannot be negative");
        }
    }
}
