package com.lbg.markets.surveillance.discovery.schedule;

import com.lbg.markets.surveillance.discovery.domain.ConfigKey;
import com.lbg.markets.surveillance.discovery.domain.ErrorCategory;
import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import com.lbg.markets.surveillance.discovery.domain.ExecutionStatus;
import com.lbg.markets.surveillance.discovery.domain.ExecutionTrigger;
import com.lbg.markets.surveillance.discovery.domain.NotificationTarget;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;
import com.lbg.markets.surveillance.discovery.history.ExecutionHistoryStore;
import com.lbg.markets.surveillance.discovery.orchestration.ExecutionDispatcher;
import com.lbg.markets.surveillance.discovery.store.ConfigurationStore;
import com.lbg.markets.surveillance.discovery.support.Await;
import com.lbg.markets.surveillance.discovery.support.StubHttpServer;
import com.lbg.markets.surveillance.discovery.support.StubHttpServer.Response;
import com.lbg.markets.surveillance.discovery.support.TestConfigurations;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
class ExecutionWatchdogTest {

    @Inject
    ExecutionWatchdog watchdog;

    @Inject
    ExecutionHistoryStore history;

    @Inject
    ExecutionDispatcher dispatcher;

    @Inject
    ConfigurationStore configurationStore;

    @Test
    void shouldCloseRecordsAbandonedPastDeadline() {
        ConfigKey key = new ConfigKey(TestConfigurations.uniqueTenant(), "feed");
        Instant now = Instant.now();
        String executionId = UUID.randomUUID().toString();
        history.createPending(ExecutionRecord.pending(executionId, key, ExecutionTrigger.SCHEDULED,
                now.minus(Duration.ofHours(3)), now.minus(Duration.ofHours(2))));

        assertTrue(watchdog.sweep(now) >= 1);

        ExecutionRecord closed = history.find(executionId).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, closed.status());
        assertEquals(ErrorCategory.CANCELLED, closed.errorCategory());
    }

    @Test
    void shouldLeaveRecordsWithinGraceAlone() {
        ConfigKey key = new ConfigKey(TestConfigurations.uniqueTenant(), "feed");
        Instant now = Instant.now();
        String executionId = UUID.randomUUID().toString();
        history.createPending(ExecutionRecord.pending(executionId, key, ExecutionTrigger.SCHEDULED,
                now.minusSeconds(120), now.minusSeconds(30)));

        watchdog.sweep(now);

        assertEquals(ExecutionStatus.PENDING, history.find(executionId).orElseThrow().status());
        history.complete(history.find(executionId).orElseThrow()
                .failed(now, null, ErrorCategory.CANCELLED, "test cleanup"));
    }

    @Test
    void shouldCancelRunningExecutionPastDeadline() throws IOException {
        try (StubHttpServer server = StubHttpServer.start()) {
            server.respond("/slow", Response.of(200, "[]").delayed(3000));
            String tenant = TestConfigurations.uniqueTenant();
            RetrievalConfiguration config = configurationStore.create(TestConfigurations.configuration(tenant,
                    "feed", TestConfigurations.web(server.baseUrl()), "/slow", "*", "csv",
                    List.of(NotificationTarget.broadcast("FileAvailable." + tenant))));
            String executionId = dispatcher.dispatch(config.key(), ExecutionTrigger.MANUAL).orElseThrow();
            Await.until("listing request", () -> server.requestCount("GET", "/slow") > 0);

            // Past the execution timeout but still within the abandon grace
            assertTrue(watchdog.sweep(Instant.now().plus(Duration.ofMinutes(11))) >= 1);

            Await.until("cancelled execution", () -> !dispatcher.isInFlight(config.key()));
            ExecutionRecord record = history.find(executionId).orElseThrow();
            assertEquals(ExecutionStatus.FAILED, record.status());
            assertEquals(ErrorCategory.CANCELLED, record.errorCategory());
        }
    }
}
