package com.lbg.markets.surveillance.discovery.schedule;

import com.lbg.markets.surveillance.discovery.config.DiscoveryConfig;
import com.lbg.markets.surveillance.discovery.history.ExecutionHistoryStore;
import com.lbg.markets.surveillance.discovery.orchestration.ExecutionDispatcher;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;

/**
 * Enforces execution deadlines. Running executions past their deadline are cancelled; records
 * still open well after their deadline (typically left by a node that died mid-run) are closed
 * as FAILED / CANCELLED.
 */
@ApplicationScoped
public class ExecutionWatchdog {

    private static final Logger LOG = Logger.getLogger(ExecutionWatchdog.class);

    @Inject
    ExecutionDispatcher dispatcher;

    @Inject
    ExecutionHistoryStore history;

    @Inject
    DiscoveryConfig config;

    @Inject
    Clock clock;

    @Scheduled(identity = "discovery-execution-watchdog",
            every = "${discovery.execution.watchdog-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledSweep() {
        try {
            sweep(clock.instant());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Watchdog sweep failed");
        }
    }

    /**
     * @return in-flight executions cancelled plus abandoned records closed
     */
    public int sweep(Instant now) {
        int cancelled = dispatcher.cancelOverdue(now);
        int closed = history.closeAbandoned(now.minus(config.execution().abandonGrace()), now);
        if (cancelled > 0 || closed > 0) {
            LOG.warnf("Watchdog cancelled %d overdue executions and closed %d abandoned records", cancelled, closed);
        }
        return cancelled + closed;
    }
}
