package com.lbg.markets.surveillance.discovery.history;

import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import com.lbg.markets.surveillance.discovery.domain.Page;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of execution records. A record is inserted once as PENDING and
 * then only moved forward; terminal records are never written again.
 */
public interface ExecutionHistoryStore {

    ExecutionRecord createPending(ExecutionRecord pending);

    /**
     * @return false if the record was no longer PENDING
     */
    boolean markRunning(ExecutionRecord running);

    /**
     * Stores progress of a running execution (resolved patterns).
     */
    boolean updateRunning(ExecutionRecord running);

    /**
     * Writes the terminal state.
     *
     * @return false if the record had already been closed, e.g. by the watchdog
     */
    boolean complete(ExecutionRecord terminal);

    Optional<ExecutionRecord> find(String executionId);

    Page<ExecutionRecord> query(ExecutionQuery query);

    /**
     * All of a tenant's executions created in [from, to), optionally for one configuration.
     */
    List<ExecutionRecord> findInWindow(String tenantId, String configurationId, Instant from, Instant to);

    /**
     * Fails every PENDING or RUNNING record whose deadline is before {@code cutoff}.
     *
     * @return number of records closed
     */
    int closeAbandoned(Instant cutoff, Instant now);
}
