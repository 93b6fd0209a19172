package com.lbg.markets.surveillance.discovery.ledger;

import com.lbg.markets.surveillance.discovery.domain.DiscoveredFile;
import com.lbg.markets.surveillance.discovery.domain.Page;
import com.lbg.markets.surveillance.discovery.domain.ProcessedFileRecord;

import java.time.LocalDate;

/**
 * Durable record of files already handled, keyed by
 * (tenant, configuration, locator, discovery date).
 */
public interface DeduplicationLedger {

    /** Column widths; longer entries cannot be claimed. */
    int MAX_FILENAME_LENGTH = 1024;
    int MAX_LOCATOR_LENGTH = 2048;

    /**
     * Claims a file for an execution.
     *
     * @return true if this call created the entry, false if it already existed
     */
    boolean tryMarkProcessed(String tenantId, String configurationId, String executionId,
                             DiscoveredFile file, LocalDate discoveryDate);

    /**
     * Drops a claim made by {@code executionId}, so the file is picked up again next cycle.
     * Claims of other executions are left alone.
     *
     * @return true if a claim was removed
     */
    boolean release(String tenantId, String configurationId, String executionId,
                    String locator, LocalDate discoveryDate);

    Page<ProcessedFileRecord> query(LedgerQuery query);

    boolean isProcessed(String tenantId, String configurationId, String locator, LocalDate discoveryDate);

    /**
     * Everything one execution claimed.
     */
    default Page<ProcessedFileRecord> findByExecution(String tenantId, String configurationId, String executionId) {
        return query(LedgerQuery.byExecution(tenantId, configurationId, executionId));
    }
}
