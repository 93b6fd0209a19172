package com.lbg.markets.surveillance.discovery.notify;

import com.lbg.markets.surveillance.discovery.domain.DeliveryMode;
import com.lbg.markets.surveillance.discovery.domain.DiscoveredFile;
import com.lbg.markets.surveillance.discovery.domain.FtpSettings;
import com.lbg.markets.surveillance.discovery.domain.NotificationTarget;
import com.lbg.markets.surveillance.discovery.domain.ProtocolType;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;
import com.lbg.markets.surveillance.discovery.domain.Schedule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class NotificationFactoryTest {

    private static final LocalDate DAY = LocalDate.of(2026, 2, 23);

    private final NotificationFactory factory = new NotificationFactory();

    private final NotificationTarget broadcast = NotificationTarget.broadcast("FileAvailable");
    private final NotificationTarget command = new NotificationTarget(DeliveryMode.DIRECTED, "IngestFile",
            "ingest.commands", Map.of("source", "{configurationId}", "path", "{locator}", "retries", 3));

    private final RetrievalConfiguration config = new RetrievalConfiguration("acme", "daily-trades", "Daily trades",
            null, ProtocolType.FTP, new FtpSettings("ftp.example.com", 21, null, null, false, true, 30),
            "/in", "*.csv", null, new Schedule("0 6 * * *", "UTC"), null, true, List.of(broadcast, command),
            "alice", null, null, null, null, null, 1);

    private final DiscoveredFile file = new DiscoveredFile("a.csv", "ftp://ftp.example.com:21/in/a.csv", 120,
            null, Instant.parse("2026-02-23T06:00:01Z"));

    @Test
    void shouldKeyNotificationsByFileIdentityAndDate() {
        FileDiscoveredNotification notification = factory.create(config, "exec-1", broadcast, file, DAY);

        assertEquals("acme:daily-trades:ftp://ftp.example.com:21/in/a.csv:2026-02-23", notification.idempotencyKey());
        assertEquals("FileAvailable", notification.typeName());
        assertEquals("Daily trades", notification.configurationName());
        assertEquals(DAY, notification.discoveryDate());
    }

    @Test
    void shouldKeepMessageIdStableAcrossExecutions() {
        FileDiscoveredNotification first = factory.create(config, "exec-1", broadcast, file, DAY);
        FileDiscoveredNotification second = factory.create(config, "exec-2", broadcast, file, DAY);

        assertEquals(first.messageId(), second.messageId());
        assertNotEquals(first.messageId(), factory.create(config, "exec-1", command, file, DAY).messageId());
    }

    @Test
    void shouldSubstituteStaticPayload() {
        FileDiscoveredNotification notification = factory.create(config, "exec-1", command, file, DAY);

        assertEquals("daily-trades", notification.data().get("source"));
        assertEquals("ftp://ftp.example.com:21/in/a.csv", notification.data().get("path"));
        assertEquals(3, notification.data().get("retries"));
        assertEquals(notification.idempotencyKey(), "acme:daily-trades:ftp://ftp.example.com:21/in/a.csv:2026-02-23:cmd");
    }
}
