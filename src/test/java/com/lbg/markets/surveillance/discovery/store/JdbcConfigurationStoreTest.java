package com.lbg.markets.surveillance.discovery.store;

import com.lbg.markets.surveillance.discovery.domain.BlobAuthMode;
import com.lbg.markets.surveillance.discovery.domain.BlobSettings;
import com.lbg.markets.surveillance.discovery.domain.ConfigKey;
import com.lbg.markets.surveillance.discovery.domain.DeliveryMode;
import com.lbg.markets.surveillance.discovery.domain.NotificationTarget;
import com.lbg.markets.surveillance.discovery.domain.Page;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;
import com.lbg.markets.surveillance.discovery.support.TestConfigurations;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
class JdbcConfigurationStoreTest {

    @Inject
    ConfigurationStore store;

    private static RetrievalConfiguration ftpConfig(String tenantId, String configurationId) {
        return TestConfigurations.configuration(tenantId, configurationId,
                TestConfigurations.ftp("ftp.example.com", 21), "/outbound/{yyyy}/{mm}/{dd}", "trades_*", "csv",
                List.of(NotificationTarget.broadcast("FileAvailable"),
                        new NotificationTarget(DeliveryMode.DIRECTED, "IngestFile", "ingest.commands",
                                Map.of("priority", "high", "attempts", 3))));
    }

    @Test
    void shouldCreateAtVersionOneWithFirstRun() {
        String tenant = TestConfigurations.uniqueTenant();

        RetrievalConfiguration created = store.create(ftpConfig(tenant, "daily"));

        assertEquals(1, created.version());
        assertNotNull(created.nextScheduledRun());
        assertTrue(created.nextScheduledRun().isAfter(created.createdAt()));
        assertNull(created.lastExecutedAt());
    }

    @Test
    void shouldReadBackSettingsAndTargets() {
        String tenant = TestConfigurations.uniqueTenant();
        BlobSettings blob = new BlobSettings("acmedata", "landing", "feeds", BlobAuthMode.SAS_TOKEN, "blob-key",
                null, 20);
        RetrievalConfiguration config = TestConfigurations.configuration(tenant, "blob-feed", blob, "{yyyy}",
                "*", null, List.of(NotificationTarget.directed("IngestFile", "ingest")));
        store.create(config);

        RetrievalConfiguration loaded = store.get(new ConfigKey(tenant, "blob-feed"));

        assertEquals(blob, loaded.settings());
        assertEquals(config.targets(), loaded.targets());
        assertEquals(config.schedule(), loaded.schedule());
        assertTrue(loaded.active());
    }

    @Test
    void shouldRejectInvalidAndDuplicateConfigurations() {
        String tenant = TestConfigurations.uniqueTenant();
        store.create(ftpConfig(tenant, "daily"));

        ValidationException duplicate = assertThrows(ValidationException.class,
                () -> store.create(ftpConfig(tenant, "daily")));
        assertTrue(duplicate.errors().get(0).contains("already exists"));

        RetrievalConfiguration bad = TestConfigurations.configuration(tenant, "bad",
                TestConfigurations.ftp("ftp.example.com", 21), "/in/{hh}", "*", null, "0 25 * * *",
                List.of(NotificationTarget.broadcast("FileAvailable")));
        ValidationException invalid = assertThrows(ValidationException.class, () -> store.create(bad));
        assertEquals(2, invalid.errors().size());
        assertTrue(store.find(new ConfigKey(tenant, "bad")).isEmpty());
    }

    @Test
    void shouldDetectConcurrentModification() {
        String tenant = TestConfigurations.uniqueTenant();
        RetrievalConfiguration created = store.create(ftpConfig(tenant, "daily"));
        Instant now = Instant.now();

        RetrievalConfiguration updated = store.update(created.withExecution(now, now.plusSeconds(60), now));

        assertEquals(2, updated.version());
        assertEquals(2, store.get(created.key()).version());
        assertThrows(ConcurrencyConflictException.class,
                () -> store.update(created.withNextScheduledRun(now.plusSeconds(120))));
    }

    @Test
    void shouldFailUpdateOfUnknownConfiguration() {
        RetrievalConfiguration ghost = ftpConfig(TestConfigurations.uniqueTenant(), "ghost").withVersion(1);

        assertThrows(ConfigurationNotFoundException.class, () -> store.update(ghost));
        assertThrows(ConfigurationNotFoundException.class, () -> store.get(ghost.key()));
    }

    @Test
    void shouldFindOnlyActiveDueConfigurations() {
        String tenant = TestConfigurations.uniqueTenant();
        RetrievalConfiguration due = store.create(ftpConfig(tenant, "due"));
        RetrievalConfiguration later = store.create(ftpConfig(tenant, "later"));
        RetrievalConfiguration inactive = store.create(ftpConfig(tenant, "inactive"));
        Instant now = Instant.now();

        store.update(due.withNextScheduledRun(now.minusSeconds(60)));
        store.update(inactive.withNextScheduledRun(now.minusSeconds(60)));
        store.deactivate(inactive.key(), "bob");

        List<String> found = new ArrayList<>();
        for (RetrievalConfiguration config : store.findDue(now, 10_000)) {
            if (config.tenantId().equals(tenant)) {
                found.add(config.configurationId());
            }
        }

        assertEquals(List.of("due"), found);
        assertFalse(store.get(inactive.key()).active());
        assertEquals("bob", store.get(inactive.key()).modifiedBy());
        assertTrue(store.get(later.key()).nextScheduledRun().isAfter(now));
    }

    @Test
    void shouldPageThroughTenantConfigurations() {
        String tenant = TestConfigurations.uniqueTenant();
        for (String id : List.of("c1", "c2", "c3", "c4", "c5")) {
            store.create(ftpConfig(tenant, id));
        }
        store.create(ftpConfig(TestConfigurations.uniqueTenant(), "c1"));

        List<String> seen = new ArrayList<>();
        Page<RetrievalConfiguration> page = store.list(tenant, 2, null);
        seen.addAll(page.items().stream().map(RetrievalConfiguration::configurationId).toList());
        while (page.hasMore()) {
            page = store.list(tenant, 2, page.continuationToken());
            seen.addAll(page.items().stream().map(RetrievalConfiguration::configurationId).toList());
        }

        assertEquals(List.of("c1", "c2", "c3", "c4", "c5"), seen);
    }
}
