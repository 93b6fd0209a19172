package com.lbg.markets.surveillance.discovery.schedule;

import com.lbg.markets.surveillance.discovery.config.DiscoveryConfig;
import com.lbg.markets.surveillance.discovery.domain.ExecutionTrigger;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;
import com.lbg.markets.surveillance.discovery.orchestration.ExecutionDispatcher;
import com.lbg.markets.surveillance.discovery.store.ConfigurationStore;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic scan for due configurations. Each tick hands every due configuration that is not
 * already in flight to the {@link ExecutionDispatcher}; it never waits for executions to finish.
 */
@ApplicationScoped
public class SchedulerLoop {

    private static final Logger LOG = Logger.getLogger(SchedulerLoop.class);

    @Inject
    ConfigurationStore configurationStore;

    @Inject
    ExecutionDispatcher dispatcher;

    @Inject
    DiscoveryConfig config;

    @Inject
    Clock clock;

    private final AtomicBoolean running = new AtomicBoolean();

    void onStart(@Observes StartupEvent event) {
        if (config.scheduler().enabled()) {
            start();
        } else {
            LOG.info("Scheduler disabled; executions run only when triggered manually");
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            LOG.infof("Scheduler started, scanning every %s", config.scheduler().tick());
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            LOG.info("Scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Scheduled(identity = "discovery-scheduler-tick",
            every = "${discovery.scheduler.tick}",
            delayed = "${discovery.scheduler.initial-delay}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledTick() {
        try {
            tick(clock.instant());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Scheduler tick failed");
        }
    }

    /**
     * One scan.
     *
     * @return the number of executions dispatched
     */
    public int tick(Instant now) {
        if (!running.get()) {
            return 0;
        }
        List<RetrievalConfiguration> due = configurationStore.findDue(now, config.scheduler().batchSize());
        if (due.isEmpty()) {
            return 0;
        }
        LOG.debugf("%d configurations due at %s", due.size(), now);

        int dispatched = 0;
        for (RetrievalConfiguration configuration : due) {
            if (dispatcher.isInFlight(configuration.key())) {
                LOG.debugf("Skipping %s, previous execution still running", configuration.key());
                continue;
            }
            try {
                if (dispatcher.dispatch(configuration.key(), ExecutionTrigger.SCHEDULED).isPresent()) {
                    dispatched++;
                }
            } catch (RuntimeException e) {
                LOG.errorf(e, "Could not dispatch %s", configuration.key());
            }
        }
        if (dispatched > 0) {
            LOG.infof("Dispatched %d of %d due configurations", dispatched, due.size());
        }
        return dispatched;
    }
}
