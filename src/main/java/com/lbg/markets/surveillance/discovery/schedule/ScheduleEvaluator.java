package com.lbg.markets.surveillance.discovery.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.lbg.markets.surveillance.discovery.domain.Schedule;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Five-field (UNIX) cron evaluation in an IANA zone.
 * <p>
 * Cron fields are matched against local wall-clock time. Daylight saving policy:
 * <ul>
 *     <li>a wall time skipped by a spring-forward gap fires at the end of the gap;</li>
 *     <li>a wall time repeated by a fall-back overlap fires once, at its first occurrence.</li>
 * </ul>
 */
@ApplicationScoped
public class ScheduleEvaluator {

    // Enough to step over any run of candidates that fall on already-passed DST duplicates
    private static final int MAX_CANDIDATES = 1_000;

    private final CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private final Map<String, ExecutionTime> cache = new ConcurrentHashMap<>();

    public boolean isDue(Schedule schedule, Instant lastRun, Instant now) {
        return isDue(schedule.cronExpression(), schedule.zoneId(), lastRun, now);
    }

    /**
     * A configuration that never ran is due immediately; otherwise it is due once
     * the first fire time after its last run has been reached.
     */
    public boolean isDue(String cronExpression, String zoneId, Instant lastRun, Instant now) {
        if (lastRun == null) {
            return true;
        }
        return !nextRun(cronExpression, zoneId, lastRun).isAfter(now);
    }

    public Instant nextRun(Schedule schedule, Instant after) {
        return nextRun(schedule.cronExpression(), schedule.zoneId(), after);
    }

    /**
     * First fire time strictly after {@code after}.
     *
     * @throws IllegalArgumentException if the expression or zone is invalid, or the expression never fires
     */
    public Instant nextRun(String cronExpression, String zoneId, Instant after) {
        ExecutionTime executionTime = executionTime(cronExpression);
        ZoneRules rules = ZoneId.of(zoneId).getRules();

        // cron-utils walks wall-clock time; UTC has no transitions, so it never adjusts the local fields
        ZonedDateTime cursor = LocalDateTime.ofInstant(after, rules.getOffset(after)).atZone(ZoneOffset.UTC);

        for (int i = 0; i < MAX_CANDIDATES; i++) {
            Optional<ZonedDateTime> next = executionTime.nextExecution(cursor);
            if (next.isEmpty()) {
                throw new IllegalArgumentException("Cron expression never fires: " + cronExpression);
            }
            Instant candidate = toInstant(next.get().toLocalDateTime(), rules);
            if (candidate.isAfter(after)) {
                return candidate;
            }
            cursor = next.get();
        }
        throw new IllegalArgumentException("No fire time found for cron expression: " + cronExpression);
    }

    /**
     * Problems with a schedule, empty when it can be used.
     */
    public List<String> validate(String cronExpression, String zoneId) {
        List<String> problems = new ArrayList<>();
        if (zoneId == null || zoneId.isBlank()) {
            problems.add("Time zone is required");
        } else {
            try {
                ZoneId.of(zoneId);
            } catch (DateTimeException e) {
                problems.add("Unknown time zone: " + zoneId);
            }
        }
        if (cronExpression == null || cronExpression.isBlank()) {
            problems.add("Cron expression is required");
            return problems;
        }
        ExecutionTime executionTime;
        try {
            executionTime = executionTime(cronExpression);
        } catch (IllegalArgumentException e) {
            problems.add("Invalid cron expression '" + cronExpression + "': " + e.getMessage());
            return problems;
        }
        if (executionTime.nextExecution(ZonedDateTime.now(ZoneOffset.UTC)).isEmpty()) {
            problems.add("Cron expression never fires: " + cronExpression);
        }
        return problems;
    }

    private ExecutionTime executionTime(String cronExpression) {
        return cache.computeIfAbsent(cronExpression.trim(), expr -> {
            Cron cron = parser.parse(expr);
            cron.validate();
            return ExecutionTime.forCron(cron);
        });
    }

    static Instant toInstant(LocalDateTime wallTime, ZoneRules rules) {
        List<ZoneOffset> offsets = rules.getValidOffsets(wallTime);
        if (offsets.isEmpty()) {
            ZoneOffsetTransition gap = rules.getTransition(wallTime);
            return gap.getInstant();
        }
        return offsets.stream()
                .map(wallTime::toInstant)
                .min(Comparator.naturalOrder())
                .orElseThrow();
    }
}
