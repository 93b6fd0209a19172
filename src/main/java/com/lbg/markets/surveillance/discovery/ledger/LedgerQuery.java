package com.lbg.markets.surveillance.discovery.ledger;

/**
 * Operational lookup over one configuration's ledger. Null filters match everything.
 */
public record LedgerQuery(
        String tenantId,
        String configurationId,
        String filename,
        String executionId,
        int pageSize,
        String continuationToken
) {
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 1000;

    public LedgerQuery {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be blank");
        }
        if (configurationId == null || configurationId.isBlank()) {
            throw new IllegalArgumentException("configurationId cannot be blank");
        }
        if (pageSize <= 0) {
            pageSize = DEFAULT_PAGE_SIZE;
        }
        pageSize = Math.min(pageSize, MAX_PAGE_SIZE);
    }

    public static LedgerQuery byExecution(String tenantId, String configurationId, String executionId) {
        return new LedgerQuery(tenantId, configurationId, null, executionId, MAX_PAGE_SIZE, null);
    }
}
