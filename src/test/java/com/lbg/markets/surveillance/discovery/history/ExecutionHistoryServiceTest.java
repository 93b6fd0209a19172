package com.lbg.markets.surveillance.discovery.history;

import com.lbg.markets.surveillance.discovery.domain.ConfigKey;
import com.lbg.markets.surveillance.discovery.domain.DiscoveredFile;
import com.lbg.markets.surveillance.discovery.domain.ErrorCategory;
import com.lbg.markets.surveillance.discovery.domain.ExecutionCounts;
import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import com.lbg.markets.surveillance.discovery.domain.ExecutionStatus;
import com.lbg.markets.surveillance.discovery.domain.ExecutionTrigger;
import com.lbg.markets.surveillance.discovery.domain.Page;
import com.lbg.markets.surveillance.discovery.ledger.DeduplicationLedger;
import com.lbg.markets.surveillance.discovery.support.TestConfigurations;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
class ExecutionHistoryServiceTest {

    private static final Instant BASE = Instant.parse("2099-02-20T06:00:00Z");

    @Inject
    ExecutionHistoryStore store;

    @Inject
    ExecutionHistoryService service;

    @Inject
    DeduplicationLedger ledger;

    private ExecutionRecord pending(ConfigKey key, Instant createdAt) {
        String id = UUID.randomUUID().toString();
        return store.createPending(ExecutionRecord.pending(id, key, ExecutionTrigger.SCHEDULED, createdAt,
                createdAt.plusSeconds(600)));
    }

    private ExecutionRecord completed(ConfigKey key, Instant createdAt, ExecutionCounts counts) {
        ExecutionRecord running = pending(key, createdAt).running(createdAt.plusSeconds(1));
        store.markRunning(running);
        ExecutionRecord done = running.completed(createdAt.plusSeconds(3), counts);
        store.complete(done);
        return done;
    }

    @Test
    void shouldPersistLifecycleTransitions() {
        ConfigKey key = new ConfigKey(TestConfigurations.uniqueTenant(), "daily");
        ExecutionRecord pending = pending(key, BASE);
        ExecutionRecord running = pending.running(BASE.plusSeconds(1)).resolved("/in/2026/02/20", "trades_*");

        assertTrue(store.markRunning(running));
        assertFalse(store.markRunning(running));
        assertTrue(store.updateRunning(running));

        ExecutionRecord failed = running.failed(BASE.plusSeconds(5), new ExecutionCounts(1, 0, 0, 2),
                ErrorCategory.NETWORK_ERROR, "connection reset");
        assertTrue(store.complete(failed));

        ExecutionRecord loaded = store.find(pending.executionId()).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, loaded.status());
        assertEquals(ErrorCategory.NETWORK_ERROR, loaded.errorCategory());
        assertEquals("/in/2026/02/20", loaded.resolvedPath());
        assertEquals(2, loaded.counts().retryCount());
        assertEquals(4000, loaded.duration().toMillis());
    }

    @Test
    void shouldNeverOverwriteTerminalRecord() {
        ConfigKey key = new ConfigKey(TestConfigurations.uniqueTenant(), "daily");
        ExecutionRecord done = completed(key, BASE, new ExecutionCounts(2, 2, 2, 0));

        ExecutionRecord late = ExecutionRecord.pending(done.executionId(), key, ExecutionTrigger.SCHEDULED, BASE, null)
                .failed(BASE.plusSeconds(30), ExecutionCounts.NONE, ErrorCategory.CANCELLED, "too late");

        assertFalse(store.complete(late));
        assertEquals(ExecutionStatus.COMPLETED, store.find(done.executionId()).orElseThrow().status());
    }

    @Test
    void shouldListNewestFirstAcrossPages() {
        String tenant = TestConfigurations.uniqueTenant();
        ConfigKey key = new ConfigKey(tenant, "daily");
        List<String> created = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            created.add(completed(key, BASE.plusSeconds(3600L * i), ExecutionCounts.NONE).executionId());
        }
        completed(new ConfigKey(tenant, "other"), BASE, ExecutionCounts.NONE);

        List<String> listed = new ArrayList<>();
        ExecutionQuery query = new ExecutionQuery(tenant, "daily", null, null, null, 2, null);
        Page<ExecutionRecord> page = service.list(query);
        page.items().forEach(r -> listed.add(r.executionId()));
        while (page.hasMore()) {
            page = service.list(query.next(page.continuationToken()));
            page.items().forEach(r -> listed.add(r.executionId()));
        }

        List<String> expected = new ArrayList<>(created);
        Collections.reverse(expected);
        assertEquals(expected, listed);
    }

    @Test
    void shouldFilterByStatusAndWindow() {
        String tenant = TestConfigurations.uniqueTenant();
        ConfigKey key = new ConfigKey(tenant, "daily");
        completed(key, BASE, ExecutionCounts.NONE);
        completed(key, BASE.plusSeconds(86_400), ExecutionCounts.NONE);
        pending(key, BASE.plusSeconds(86_400 * 2));

        Page<ExecutionRecord> pendingOnly = service.list(
                new ExecutionQuery(tenant, null, ExecutionStatus.PENDING, null, null, 10, null));
        Page<ExecutionRecord> firstDay = service.list(
                new ExecutionQuery(tenant, null, null, BASE, BASE.plusSeconds(86_400), 10, null));

        assertEquals(1, pendingOnly.items().size());
        assertEquals(1, firstDay.items().size());
        assertEquals(BASE, firstDay.items().get(0).createdAt());
    }

    @Test
    void shouldIncludeClaimedFilesInDetail() {
        String tenant = TestConfigurations.uniqueTenant();
        ConfigKey key = new ConfigKey(tenant, "daily");
        ExecutionRecord done = completed(key, BASE, new ExecutionCounts(2, 2, 2, 0));
        for (String name : List.of("a.csv", "b.csv")) {
            ledger.tryMarkProcessed(tenant, "daily", done.executionId(),
                    new DiscoveredFile(name, "https://files/" + name, 1, null, BASE), LocalDate.of(2026, 2, 20));
        }

        ExecutionDetail detail = service.detail(tenant, done.executionId()).orElseThrow();

        assertEquals(2, detail.processedFiles().size());
        assertEquals(done.executionId(), detail.execution().executionId());
        assertTrue(service.detail("someone-else", done.executionId()).isEmpty());
    }

    @Test
    void shouldComputeMetricsOverWindow() {
        String tenant = TestConfigurations.uniqueTenant();
        ConfigKey key = new ConfigKey(tenant, "daily");
        completed(key, BASE, new ExecutionCounts(4, 3, 3, 0));
        completed(key, BASE.plusSeconds(86_400), new ExecutionCounts(2, 2, 2, 0));
        ExecutionRecord running = pending(key, BASE.plusSeconds(90_000)).running(BASE.plusSeconds(90_001));
        store.markRunning(running);
        store.complete(running.failed(BASE.plusSeconds(90_010), ExecutionCounts.NONE,
                ErrorCategory.AUTHENTICATION_FAILED, "rejected"));
        completed(key, BASE.plusSeconds(86_400 * 10), new ExecutionCounts(9, 9, 9, 0));

        ExecutionMetrics metrics = service.metrics(tenant, "daily", BASE, BASE.plusSeconds(86_400 * 3));

        assertEquals(3, metrics.totalExecutions());
        assertEquals(2, metrics.completed());
        assertEquals(1, metrics.failed());
        assertEquals(2.0 / 3.0, metrics.successRate(), 1e-9);
        assertEquals(6, metrics.filesFound());
        assertEquals(4L, metrics.filesDiscoveredPerDay().get(LocalDate.of(2099, 2, 20)));
        assertEquals(2L, metrics.filesDiscoveredPerDay().get(LocalDate.of(2099, 2, 21)));
        assertEquals(1L, metrics.failuresByCategory().get(ErrorCategory.AUTHENTICATION_FAILED));
    }

    @Test
    void shouldCloseAbandonedRecords() {
        String tenant = TestConfigurations.uniqueTenant();
        ConfigKey key = new ConfigKey(tenant, "daily");
        ExecutionRecord stuck = pending(key, BASE);
        store.markRunning(stuck.running(BASE.plusSeconds(1)));
        ExecutionRecord fresh = pending(key, BASE.plusSeconds(7200));

        store.closeAbandoned(BASE.plusSeconds(3600), BASE.plusSeconds(3600));

        ExecutionRecord closed = store.find(stuck.executionId()).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, closed.status());
        assertEquals(ErrorCategory.CANCELLED, closed.errorCategory());
        assertEquals(ExecutionStatus.PENDING, store.find(fresh.executionId()).orElseThrow().status());
    }
}
