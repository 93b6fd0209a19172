package com.lbg.markets.surveillance.discovery.orchestration;

import com.lbg.markets.surveillance.discovery.domain.NotificationTarget;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;
import com.lbg.markets.surveillance.discovery.domain.Schedule;
import com.lbg.markets.surveillance.discovery.domain.TokenTimeBasis;
import com.lbg.markets.surveillance.discovery.domain.WebSettings;
import com.lbg.markets.surveillance.discovery.support.TestConfigurations;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DiscoveryDateTest {

    private static final Instant NEW_YEARS_EVE = Instant.parse("2025-12-31T23:59:59Z");

    private static RetrievalConfiguration configuration(TokenTimeBasis basis) {
        WebSettings settings = TestConfigurations.web("https://files.example.com");
        return new RetrievalConfiguration("tenant", "feed", "Year end feed", null, settings.protocol(), settings,
                "/{yyyy}/{mm}/{dd}", "*", "csv", new Schedule("0 6 * * *", "Europe/Berlin"), basis, true,
                List.of(NotificationTarget.broadcast("FileAvailable")), "test", null, null, null, null, null, 0);
    }

    @Test
    void shouldUseScheduleZoneForDiscoveryDate() {
        assertEquals(LocalDate.of(2026, 1, 1),
                ExecutionOrchestrator.discoveryDate(configuration(TokenTimeBasis.SCHEDULE_ZONE), NEW_YEARS_EVE));
    }

    @Test
    void shouldUseUtcByDefault() {
        assertEquals(LocalDate.of(2025, 12, 31),
                ExecutionOrchestrator.discoveryDate(configuration(TokenTimeBasis.UTC), NEW_YEARS_EVE));
    }

    @Test
    void shouldKeepLeapDayUntilMidnightInScheduleZone() {
        Instant utcEvening = Instant.parse("2024-02-29T22:59:59Z");

        assertEquals(LocalDate.of(2024, 2, 29),
                ExecutionOrchestrator.discoveryDate(configuration(TokenTimeBasis.SCHEDULE_ZONE), utcEvening));
        assertEquals(LocalDate.of(2024, 3, 1), ExecutionOrchestrator.discoveryDate(
                configuration(TokenTimeBasis.SCHEDULE_ZONE), utcEvening.plusSeconds(1)));
    }
}
