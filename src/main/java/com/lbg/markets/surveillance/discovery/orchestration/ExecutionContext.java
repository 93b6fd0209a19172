package com.lbg.markets.surveillance.discovery.orchestration;

import com.lbg.markets.surveillance.discovery.domain.ConfigKey;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation signal of one execution: an explicit cancel, the deadline passing,
 * or the worker thread being interrupted.
 */
public class ExecutionContext {

    private final String executionId;
    private final ConfigKey key;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicReference<String> cancelReason = new AtomicReference<>();

    public ExecutionContext(String executionId, ConfigKey key, Instant deadline, Clock clock) {
        this.executionId = executionId;
        this.key = key;
        this.deadline = deadline;
        this.clock = clock;
    }

    public String executionId() {
        return executionId;
    }

    public ConfigKey key() {
        return key;
    }

    public Instant deadline() {
        return deadline;
    }

    public void cancel(String reason) {
        cancelReason.compareAndSet(null, reason);
    }

    public boolean isCancelled() {
        return reason() != null;
    }

    /**
     * @throws ExecutionCancelledException if the execution should stop
     */
    public void checkNotCancelled() {
        String reason = reason();
        if (reason != null) {
            throw new ExecutionCancelledException("Execution " + executionId + " cancelled: " + reason);
        }
    }

    /**
     * Sleeps for {@code duration} or until the deadline, whichever is sooner.
     */
    public void sleep(Duration duration) {
        checkNotCancelled();
        long remaining = Duration.between(clock.instant(), deadline).toMillis();
        long millis = Math.min(duration.toMillis(), Math.max(remaining, 0));
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("interrupted");
        }
        checkNotCancelled();
    }

    private String reason() {
        String reason = cancelReason.get();
        if (reason != null) {
            return reason;
        }
        if (Thread.currentThread().isInterrupted()) {
            return "interrupted";
        }
        if (deadline != null && clock.instant().isAfter(deadline)) {
            return "deadline " + deadline + " exceeded";
        }
        return null;
    }
}
