package com.lbg.markets.surveillance.discovery.orchestration;

import com.lbg.markets.surveillance.discovery.config.DiscoveryConfig;
import com.lbg.markets.surveillance.discovery.domain.ConfigKey;
import com.lbg.markets.surveillance.discovery.domain.ErrorCategory;
import com.lbg.markets.surveillance.discovery.domain.ExecutionCounts;
import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import com.lbg.markets.surveillance.discovery.domain.ExecutionTrigger;
import com.lbg.markets.surveillance.discovery.history.ExecutionHistoryStore;
import com.lbg.markets.surveillance.discovery.notify.ExecutionEventPublisher;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool for executions. At most one execution per configuration is in
 * flight at any time; further requests for the same configuration are refused until
 * it finishes.
 */
@ApplicationScoped
public class ExecutionDispatcher {

    private static final Logger LOG = Logger.getLogger(ExecutionDispatcher.class);

    @Inject
    ExecutionOrchestrator orchestrator;

    @Inject
    ExecutionHistoryStore history;

    @Inject
    ExecutionEventPublisher events;

    @Inject
    DiscoveryConfig config;

    @Inject
    Clock clock;

    private final Map<ConfigKey, InFlight> inFlight = new ConcurrentHashMap<>();
    private ThreadPoolExecutor workers;

    @PostConstruct
    void init() {
        int poolSize = config.workers().poolSize();
        workers = new ThreadPoolExecutor(poolSize, poolSize, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(config.workers().queueCapacity()), new WorkerThreadFactory());
        LOG.infof("Execution pool started with %d workers, queue capacity %d",
                poolSize, config.workers().queueCapacity());
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
        inFlight.values().forEach(entry -> entry.context.cancel("shutdown"));
        try {
            if (!workers.awaitTermination(config.workers().shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warnf("Interrupting %d executions still running at shutdown", inFlight.size());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Records a PENDING execution and queues it.
     *
     * @return the execution id, or empty if the configuration already has an execution in flight
     */
    public Optional<String> dispatch(ConfigKey key, ExecutionTrigger trigger) {
        Instant now = clock.instant();
        String executionId = UUID.randomUUID().toString();
        Instant deadline = now.plus(config.execution().timeout());
        InFlight entry = new InFlight(new ExecutionContext(executionId, key, deadline, clock));

        InFlight existing = inFlight.putIfAbsent(key, entry);
        if (existing != null) {
            LOG.debugf("Skipping %s: execution %s still in flight", key, existing.context.executionId());
            return Optional.empty();
        }

        ExecutionRecord pending;
        try {
            pending = history.createPending(ExecutionRecord.pending(executionId, key, trigger, now, deadline));
        } catch (RuntimeException e) {
            inFlight.remove(key, entry);
            throw e;
        }

        entry.pending = pending;
        FutureTask<Void> task = new FutureTask<>(() -> run(key, entry, pending), null);
        entry.task = task;
        try {
            workers.execute(task);
            LOG.debugf("Dispatched execution %s for %s", executionId, key);
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, entry);
            LOG.warnf("Worker pool saturated; execution %s for %s not started", executionId, key);
            close(pending, "Worker pool saturated");
        }
        return Optional.of(executionId);
    }

    public boolean isInFlight(ConfigKey key) {
        return inFlight.containsKey(key);
    }

    public Optional<String> inFlightExecution(ConfigKey key) {
        InFlight entry = inFlight.get(key);
        return entry != null ? Optional.of(entry.context.executionId()) : Optional.empty();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Asks an in-flight execution to stop. It ends FAILED with category CANCELLED.
     */
    public boolean cancel(ConfigKey key, String reason) {
        InFlight entry = inFlight.get(key);
        if (entry == null) {
            return false;
        }
        stop(entry, reason);
        return true;
    }

    /**
     * Cancels every in-flight execution whose deadline is before {@code now}.
     */
    public int cancelOverdue(Instant now) {
        int cancelled = 0;
        for (InFlight entry : inFlight.values()) {
            if (entry.context.deadline().isBefore(now) && !entry.context.isCancelled()) {
                stop(entry, "deadline " + entry.context.deadline() + " exceeded");
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * A queued execution is taken off the queue and closed here, since its task will never run.
     * A started one is interrupted and closes itself.
     */
    private void stop(InFlight entry, String reason) {
        LOG.infof("Cancelling execution %s for %s: %s", entry.context.executionId(), entry.context.key(), reason);
        entry.context.cancel(reason);
        FutureTask<Void> task = entry.task;
        if (task == null) {
            return;
        }
        if (workers.remove(task)) {
            inFlight.remove(entry.context.key(), entry);
            close(entry.pending, "Execution " + entry.context.executionId() + " cancelled before it started: " + reason);
        } else if (entry.started) {
            task.cancel(true);
        }
    }

    private void close(ExecutionRecord pending, String message) {
        ExecutionRecord failed = pending.failed(clock.instant(), ExecutionCounts.NONE, ErrorCategory.CANCELLED, message);
        if (history.complete(failed)) {
            events.publish(failed);
        }
    }

    private void run(ConfigKey key, InFlight entry, ExecutionRecord pending) {
        entry.started = true;
        try {
            orchestrator.execute(pending, entry.context);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Execution %s for %s could not be recorded", pending.executionId(), key);
        } finally {
            inFlight.remove(key, entry);
        }
    }

    private static final class InFlight {
        final ExecutionContext context;
        volatile ExecutionRecord pending;
        volatile FutureTask<Void> task;
        volatile boolean started;

        InFlight(ExecutionContext context) {
            this.context = context;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "discovery-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
