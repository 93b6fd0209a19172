package com.lbg.markets.surveillance.discovery.history;

import com.lbg.markets.surveillance.discovery.domain.ErrorCategory;
import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import com.lbg.markets.surveillance.discovery.domain.ExecutionStatus;
import com.lbg.markets.surveillance.discovery.domain.Page;
import com.lbg.markets.surveillance.discovery.domain.ProcessedFileRecord;
import com.lbg.markets.surveillance.discovery.ledger.DeduplicationLedger;
import com.lbg.markets.surveillance.discovery.ledger.LedgerQuery;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read side of the execution history: listings, per-execution detail and metrics.
 * Metrics are computed from the stored records on every call.
 */
@ApplicationScoped
public class ExecutionHistoryService {

    private static final Logger LOG = Logger.getLogger(ExecutionHistoryService.class);

    @Inject
    ExecutionHistoryStore store;

    @Inject
    DeduplicationLedger ledger;

    public Page<ExecutionRecord> list(ExecutionQuery query) {
        return store.query(query);
    }

    public Optional<ExecutionRecord> find(String executionId) {
        return store.find(executionId);
    }

    /**
     * The execution and every file it claimed in the ledger. Empty if the execution
     * does not exist or belongs to another tenant.
     */
    public Optional<ExecutionDetail> detail(String tenantId, String executionId) {
        Optional<ExecutionRecord> execution = store.find(executionId)
                .filter(record -> record.tenantId().equals(tenantId));
        if (execution.isEmpty()) {
            return Optional.empty();
        }
        ExecutionRecord record = execution.get();

        List<ProcessedFileRecord> files = new ArrayList<>();
        LedgerQuery query = LedgerQuery.byExecution(record.tenantId(), record.configurationId(), executionId);
        Page<ProcessedFileRecord> page = ledger.query(query);
        files.addAll(page.items());
        while (page.hasMore()) {
            page = ledger.query(new LedgerQuery(query.tenantId(), query.configurationId(), null, executionId,
                    query.pageSize(), page.continuationToken()));
            files.addAll(page.items());
        }
        return Optional.of(new ExecutionDetail(record, files));
    }

    /**
     * @param configurationId null for all of the tenant's configurations
     */
    public ExecutionMetrics metrics(String tenantId, String configurationId, Instant from, Instant to) {
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("Metrics window start must be before its end");
        }
        List<ExecutionRecord> records = store.findInWindow(tenantId, configurationId, from, to);
        ExecutionMetrics metrics = aggregate(records, from, to);
        LOG.debugf("Metrics for %s/%s over [%s, %s): %d executions",
                tenantId, configurationId == null ? "*" : configurationId, from, to, metrics.totalExecutions());
        return metrics;
    }

    static ExecutionMetrics aggregate(List<ExecutionRecord> records, Instant from, Instant to) {
        long completed = 0;
        long failed = 0;
        long durationMillis = 0;
        long timed = 0;
        long found = 0;
        long processed = 0;
        long emitted = 0;
        Map<LocalDate, Long> perDay = new TreeMap<>();
        Map<ErrorCategory, Long> failures = new EnumMap<>(ErrorCategory.class);

        for (ExecutionRecord record : records) {
            if (record.status() == ExecutionStatus.COMPLETED) {
                completed++;
            } else if (record.status() == ExecutionStatus.FAILED) {
                failed++;
                if (record.errorCategory() != null) {
                    failures.merge(record.errorCategory(), 1L, Long::sum);
                }
            }
            Duration duration = record.duration();
            if (duration != null) {
                durationMillis += duration.toMillis();
                timed++;
            }
            found += record.counts().filesFound();
            processed += record.counts().filesProcessed();
            emitted += record.counts().notificationsEmitted();

            LocalDate day = LocalDate.ofInstant(record.createdAt(), ZoneOffset.UTC);
            perDay.merge(day, (long) record.counts().filesFound(), Long::sum);
        }

        long finished = completed + failed;
        double successRate = finished == 0 ? 0.0 : (double) completed / finished;
        Duration average = timed == 0 ? Duration.ZERO : Duration.ofMillis(durationMillis / timed);

        return new ExecutionMetrics(from, to, records.size(), completed, failed, records.size() - finished,
                successRate, average, found, processed, emitted, perDay, failures);
    }
}
