package com.lbg.markets.surveillance.discovery.orchestration;

import com.lbg.markets.surveillance.discovery.config.DiscoveryConfig;
import com.lbg.markets.surveillance.discovery.domain.ConfigKey;
import com.lbg.markets.surveillance.discovery.domain.ErrorCategory;
import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import com.lbg.markets.surveillance.discovery.domain.ExecutionStatus;
import com.lbg.markets.surveillance.discovery.domain.ExecutionTrigger;
import com.lbg.markets.surveillance.discovery.domain.NotificationTarget;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;
import com.lbg.markets.surveillance.discovery.history.ExecutionHistoryStore;
import com.lbg.markets.surveillance.discovery.store.ConfigurationStore;
import com.lbg.markets.surveillance.discovery.support.Await;
import com.lbg.markets.surveillance.discovery.support.StubHttpServer;
import com.lbg.markets.surveillance.discovery.support.StubHttpServer.Response;
import com.lbg.markets.surveillance.discovery.support.TestConfigurations;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
class ExecutionDispatcherTest {

    @Inject
    ExecutionDispatcher dispatcher;

    @Inject
    ExecutionHistoryStore history;

    @Inject
    ConfigurationStore configurationStore;

    @Inject
    DiscoveryConfig config;

    private StubHttpServer server;
    private String tenant;
    private final List<ConfigKey> dispatched = new ArrayList<>();

    @BeforeEach
    void setup() throws IOException {
        server = StubHttpServer.start();
        server.respond("/slow", Response.of(200, "[]").delayed(3000));
        tenant = TestConfigurations.uniqueTenant();
    }

    @AfterEach
    void cleanup() {
        dispatched.forEach(key -> dispatcher.cancel(key, "test cleanup"));
        Await.until("idle workers", Duration.ofSeconds(10),
                () -> dispatched.stream().noneMatch(dispatcher::isInFlight));
        server.close();
    }

    private ConfigKey create(String configurationId) {
        RetrievalConfiguration created = configurationStore.create(TestConfigurations.configuration(tenant,
                configurationId, TestConfigurations.web(server.baseUrl()), "/slow", "*", "csv",
                List.of(NotificationTarget.broadcast("FileAvailable." + tenant))));
        dispatched.add(created.key());
        return created.key();
    }

    private void fillPool() {
        int poolSize = config.workers().poolSize();
        for (int i = 0; i < poolSize; i++) {
            assertTrue(dispatcher.dispatch(create("busy-" + i), ExecutionTrigger.MANUAL).isPresent());
        }
        Await.until("all workers busy", () -> server.requestCount("GET", "/slow") >= poolSize);
    }

    @Test
    void shouldCloseQueuedExecutionWhenCancelled() {
        fillPool();
        ConfigKey queued = create("queued");
        String executionId = dispatcher.dispatch(queued, ExecutionTrigger.MANUAL).orElseThrow();
        assertTrue(dispatcher.isInFlight(queued));

        assertTrue(dispatcher.cancel(queued, "operator request"));

        assertFalse(dispatcher.isInFlight(queued));
        ExecutionRecord record = history.find(executionId).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, record.status());
        assertEquals(ErrorCategory.CANCELLED, record.errorCategory());
        assertTrue(record.errorMessage().contains("operator request"));
        assertNull(record.startedAt());
    }

    @Test
    void shouldAcceptNewRunAfterQueuedCancel() {
        fillPool();
        ConfigKey queued = create("queued");
        String first = dispatcher.dispatch(queued, ExecutionTrigger.MANUAL).orElseThrow();
        dispatcher.cancel(queued, "operator request");

        Optional<String> second = dispatcher.dispatch(queued, ExecutionTrigger.MANUAL);

        assertTrue(second.isPresent());
        assertFalse(first.equals(second.get()));
        assertEquals(Optional.of(second.get()), dispatcher.inFlightExecution(queued));
    }

    @Test
    void shouldRejectSecondDispatchWhileInFlight() {
        ConfigKey key = create("feed");
        assertTrue(dispatcher.dispatch(key, ExecutionTrigger.MANUAL).isPresent());

        assertTrue(dispatcher.dispatch(key, ExecutionTrigger.SCHEDULED).isEmpty());
    }

    @Test
    void shouldInterruptStartedExecutionOnCancel() {
        ConfigKey key = create("feed");
        String executionId = dispatcher.dispatch(key, ExecutionTrigger.MANUAL).orElseThrow();
        Await.until("listing request", () -> server.requestCount("GET", "/slow") > 0);

        assertTrue(dispatcher.cancel(key, "operator request"));

        Await.until("cancelled execution", () -> !dispatcher.isInFlight(key));
        ExecutionRecord record = history.find(executionId).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, record.status());
        assertEquals(ErrorCategory.CANCELLED, record.errorCategory());
    }
}
