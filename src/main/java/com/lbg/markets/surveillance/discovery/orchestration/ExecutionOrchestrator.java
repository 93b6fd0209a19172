package com.lbg.markets.surveillance.discovery.orchestration;

import com.lbg.markets.surveillance.discovery.config.DiscoveryConfig;
import com.lbg.markets.surveillance.discovery.credential.CredentialResolutionException;
import com.lbg.markets.surveillance.discovery.credential.CredentialResolver;
import com.lbg.markets.surveillance.discovery.credential.ResolvedCredential;
import com.lbg.markets.surveillance.discovery.domain.ConfigKey;
import com.lbg.markets.surveillance.discovery.domain.DiscoveredFile;
import com.lbg.markets.surveillance.discovery.domain.ErrorCategory;
import com.lbg.markets.surveillance.discovery.domain.ExecutionCounts;
import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import com.lbg.markets.surveillance.discovery.domain.NotificationTarget;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;
import com.lbg.markets.surveillance.discovery.domain.TokenTimeBasis;
import com.lbg.markets.surveillance.discovery.history.ExecutionHistoryStore;
import com.lbg.markets.surveillance.discovery.ledger.DeduplicationLedger;
import com.lbg.markets.surveillance.discovery.notify.ExecutionEventPublisher;
import com.lbg.markets.surveillance.discovery.notify.FileDiscoveredNotification;
import com.lbg.markets.surveillance.discovery.notify.NotificationException;
import com.lbg.markets.surveillance.discovery.notify.NotificationFactory;
import com.lbg.markets.surveillance.discovery.notify.NotificationTransport;
import com.lbg.markets.surveillance.discovery.protocol.ListingRequest;
import com.lbg.markets.surveillance.discovery.protocol.ProtocolAdapter;
import com.lbg.markets.surveillance.discovery.protocol.ProtocolAdapterRegistry;
import com.lbg.markets.surveillance.discovery.protocol.ProtocolException;
import com.lbg.markets.surveillance.discovery.schedule.ScheduleEvaluator;
import com.lbg.markets.surveillance.discovery.store.ConcurrencyConflictException;
import com.lbg.markets.surveillance.discovery.store.ConfigurationNotFoundException;
import com.lbg.markets.surveillance.discovery.store.ConfigurationStore;
import com.lbg.markets.surveillance.discovery.store.StoreException;
import com.lbg.markets.surveillance.discovery.util.TokenResolver;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives one discovery cycle for one configuration:
 * resolve patterns → list → claim in ledger → notify → record outcome → reschedule.
 * <p>
 * Every failure is categorised here and ends up in the execution record; nothing
 * propagates to the caller.
 */
@ApplicationScoped
public class ExecutionOrchestrator {

    private static final Logger LOG = Logger.getLogger(ExecutionOrchestrator.class);

    private static final int MAX_LISTED_FAILURES = 10;

    @Inject
    ConfigurationStore configurationStore;

    @Inject
    ProtocolAdapterRegistry adapters;

    @Inject
    CredentialResolver credentialResolver;

    @Inject
    DeduplicationLedger ledger;

    @Inject
    NotificationFactory notificationFactory;

    @Inject
    NotificationTransport transport;

    @Inject
    ExecutionHistoryStore history;

    @Inject
    ExecutionEventPublisher events;

    @Inject
    ScheduleEvaluator scheduleEvaluator;

    @Inject
    DiscoveryConfig config;

    @Inject
    Clock clock;

    /**
     * Runs a PENDING execution to a terminal state.
     *
     * @return the terminal record as written to the history
     */
    public ExecutionRecord execute(ExecutionRecord pending, ExecutionContext context) {
        Instant startedAt = clock.instant();
        ExecutionRecord record = pending.running(startedAt);
        if (!history.markRunning(record)) {
            LOG.warnf("Execution %s is no longer pending; not starting it", pending.executionId());
            return history.find(pending.executionId()).orElse(pending);
        }
        ConfigKey key = pending.key();
        LOG.infof("Starting execution %s for %s (%s)", record.executionId(), key, record.trigger());
        events.publish(record);

        Tally tally = new Tally();
        ErrorCategory category = null;
        String message = null;
        boolean reschedule = false;

        try {
            RetrievalConfiguration configuration = configurationStore.get(key);
            if (!configuration.active()) {
                throw new ExecutionFailure(ErrorCategory.INTERNAL_ERROR, "Configuration " + key + " is inactive");
            }
            reschedule = true;
            context.checkNotCancelled();

            // Resolve patterns
            LocalDate discoveryDate = discoveryDate(configuration, startedAt);
            String path = TokenResolver.resolve(configuration.pathPattern(), discoveryDate);
            String namePattern = TokenResolver.resolve(configuration.namePattern(), discoveryDate);
            record = record.resolved(path, namePattern);
            history.updateRunning(record);

            // List remote files
            ProtocolAdapter adapter = adapters.adapterFor(configuration.protocol());
            ResolvedCredential credential = credentialResolver.resolve(configuration.settings().credentialHandle());
            ListingRequest request = new ListingRequest(path, namePattern, configuration.extension(),
                    config.adapter().maxResults());
            List<DiscoveredFile> files = withinLedgerLimits(
                    listWithRetry(adapter, configuration, request, credential, context, tally), key);
            tally.found = files.size();
            context.checkNotCancelled();
            LOG.debugf("Execution %s found %d candidate files under %s", record.executionId(), files.size(), path);

            // Claim and notify, in listing order
            for (DiscoveredFile file : files) {
                context.checkNotCancelled();
                processFile(configuration, record.executionId(), file, discoveryDate, tally);
            }

            if (!tally.ledgerFailures.isEmpty() || !tally.failures.isEmpty()) {
                // A cancel during the last deliveries takes precedence over the failures it caused
                context.checkNotCancelled();
            }
            if (!tally.ledgerFailures.isEmpty()) {
                category = ErrorCategory.LEDGER_ERROR;
                message = summarize("ledger write(s)", tally.ledgerFailures);
                if (!tally.failures.isEmpty()) {
                    message = message + "; " + summarize("notification(s)", tally.failures);
                }
            } else if (!tally.failures.isEmpty()) {
                category = ErrorCategory.NOTIFICATION_FAILED;
                message = summarize("notification(s)", tally.failures);
            }

        } catch (ProtocolException e) {
            category = categoryOf(e.kind());
            message = e.getMessage();
        } catch (CredentialResolutionException e) {
            category = ErrorCategory.AUTHENTICATION_FAILED;
            message = e.getMessage();
        } catch (ExecutionCancelledException e) {
            category = ErrorCategory.CANCELLED;
            message = e.getMessage();
        } catch (ExecutionFailure e) {
            category = e.category;
            message = e.getMessage();
        } catch (ConfigurationNotFoundException e) {
            category = ErrorCategory.INTERNAL_ERROR;
            message = e.getMessage();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected failure in execution %s for %s", record.executionId(), key);
            category = ErrorCategory.INTERNAL_ERROR;
            message = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        // Bookkeeping must complete even when the worker was interrupted
        boolean interrupted = Thread.interrupted();

        if (reschedule) {
            String problem = updateSchedule(key, startedAt);
            if (problem != null) {
                if (category == null) {
                    category = ErrorCategory.CONFIGURATION_CONFLICT;
                    message = problem;
                } else {
                    message = message + "; " + problem;
                }
            }
        }

        ExecutionRecord terminal = category == null
                ? record.completed(clock.instant(), tally.counts())
                : record.failed(clock.instant(), tally.counts(), category, message);
        if (history.complete(terminal)) {
            events.publish(terminal);
        } else {
            LOG.warnf("Execution %s was closed by someone else before it finished", terminal.executionId());
        }

        if (category == null) {
            LOG.infof("Execution %s for %s completed in %d ms: %d found, %d new, %d notifications",
                    terminal.executionId(), key, terminal.duration().toMillis(),
                    tally.found, tally.processed, tally.emitted);
        } else {
            LOG.errorf("Execution %s for %s failed (%s): %s", terminal.executionId(), key, category, message);
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return terminal;
    }

    private List<DiscoveredFile> listWithRetry(ProtocolAdapter adapter, RetrievalConfiguration configuration,
                                               ListingRequest request, ResolvedCredential credential,
                                               ExecutionContext context, Tally tally) throws ProtocolException {
        RetryPolicy retryPolicy = RetryPolicy.from(config.retry());
        int attempts = 0;
        while (true) {
            context.checkNotCancelled();
            attempts++;
            try {
                return adapter.list(configuration.settings(), request, credential);
            } catch (ProtocolException e) {
                if (e.kind() == ProtocolException.Kind.NOT_FOUND) {
                    LOG.infof("Nothing at %s for %s yet: %s", request.resolvedPath(), configuration.key(), e.getMessage());
                    return List.of();
                }
                if (!e.isRetryable() || !retryPolicy.canRetry(attempts)) {
                    throw e;
                }
                Duration delay = retryPolicy.backoff(attempts);
                tally.retries = attempts;
                LOG.warnf("Listing attempt %d/%d for %s failed: %s; retrying in %d ms",
                        attempts, retryPolicy.maxAttempts(), configuration.key(), e.getMessage(), delay.toMillis());
                context.sleep(delay);
            }
        }
    }

    /**
     * Claims the file, then emits one notification per target. A claim whose notifications all
     * failed is released so the next cycle retries the file; a partly notified file stays claimed.
     */
    private void processFile(RetrievalConfiguration configuration, String executionId, DiscoveredFile file,
                             LocalDate discoveryDate, Tally tally) {
        boolean created;
        try {
            created = ledger.tryMarkProcessed(configuration.tenantId(), configuration.configurationId(),
                    executionId, file, discoveryDate);
        } catch (StoreException e) {
            LOG.errorf(e, "Ledger write failed for %s; skipping it this cycle", file.locator());
            tally.ledgerFailures.add(file.filename() + ": " + e.getMessage());
            return;
        }
        if (!created) {
            LOG.debugf("Skipping %s, already processed on %s", file.locator(), discoveryDate);
            return;
        }

        int delivered = 0;
        for (NotificationTarget target : configuration.targets()) {
            FileDiscoveredNotification notification =
                    notificationFactory.create(configuration, executionId, target, file, discoveryDate);
            try {
                transport.deliver(target, notification);
                delivered++;
                tally.emitted++;
            } catch (NotificationException e) {
                LOG.warnf("Notification %s for %s failed: %s", target.typeName(), file.filename(), e.getMessage());
                tally.failures.add(target.typeName() + " for " + file.filename() + ": " + e.getMessage());
            }
        }

        if (delivered == 0) {
            try {
                ledger.release(configuration.tenantId(), configuration.configurationId(), executionId,
                        file.locator(), discoveryDate);
            } catch (StoreException e) {
                LOG.errorf(e, "Could not release claim on %s", file.locator());
                tally.ledgerFailures.add("release of " + file.filename() + ": " + e.getMessage());
            }
            return;
        }
        tally.processed++;
        LOG.debugf("Processed %s (%d/%d targets notified)", file.locator(), delivered, configuration.targets().size());
    }

    /**
     * Sets lastExecutedAt and the next fire time, re-reading on version conflicts.
     *
     * @return null on success, otherwise what went wrong
     */
    private String updateSchedule(ConfigKey key, Instant startedAt) {
        int maxAttempts = Math.max(1, config.configUpdate().maxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                RetrievalConfiguration current = configurationStore.get(key);
                Instant now = clock.instant();
                Instant nextRun = scheduleEvaluator.nextRun(current.schedule(), now);
                configurationStore.update(current.withExecution(startedAt, nextRun, now));
                LOG.debugf("Next run of %s at %s", key, nextRun);
                return null;
            } catch (ConcurrencyConflictException e) {
                LOG.warnf("Schedule update of %s hit a concurrent write (attempt %d/%d)", key, attempt, maxAttempts);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Schedule update of %s failed", key);
                return "Schedule update failed: " + e.getMessage();
            }
        }
        LOG.errorf("Gave up updating schedule of %s after %d conflicting writes", key, maxAttempts);
        return "Schedule update lost " + maxAttempts + " optimistic concurrency races";
    }

    static LocalDate discoveryDate(RetrievalConfiguration configuration, Instant at) {
        if (configuration.tokenTimeBasis() == TokenTimeBasis.SCHEDULE_ZONE) {
            return LocalDate.ofInstant(at, configuration.schedule().zone());
        }
        return LocalDate.ofInstant(at, ZoneOffset.UTC);
    }

    static ErrorCategory categoryOf(ProtocolException.Kind kind) {
        switch (kind) {
            case AUTHENTICATION_FAILED:
                return ErrorCategory.AUTHENTICATION_FAILED;
            case NETWORK_ERROR:
                return ErrorCategory.NETWORK_ERROR;
            case NOT_FOUND:
            case PROTOCOL_ERROR:
            default:
                return ErrorCategory.PROTOCOL_ERROR;
        }
    }

    /**
     * Drops entries the ledger cannot store; they would otherwise fail on every cycle.
     */
    static List<DiscoveredFile> withinLedgerLimits(List<DiscoveredFile> files, ConfigKey key) {
        List<DiscoveredFile> accepted = new ArrayList<>(files.size());
        for (DiscoveredFile file : files) {
            if (file.filename().length() > DeduplicationLedger.MAX_FILENAME_LENGTH
                    || file.locator().length() > DeduplicationLedger.MAX_LOCATOR_LENGTH) {
                LOG.warnf("Ignoring listing entry of %s with oversized name or locator (%d / %d chars): %.100s...",
                        key, file.filename().length(), file.locator().length(), file.locator());
                continue;
            }
            accepted.add(file);
        }
        return accepted;
    }

    private static String summarize(String what, List<String> failures) {
        StringBuilder sb = new StringBuilder();
        sb.append(failures.size()).append(' ').append(what).append(" failed: ");
        int shown = Math.min(failures.size(), MAX_LISTED_FAILURES);
        sb.append(String.join("; ", failures.subList(0, shown)));
        if (failures.size() > shown) {
            sb.append("; ...");
        }
        return sb.toString();
    }

    private static final class Tally {
        int found;
        int processed;
        int emitted;
        int retries;
        final List<String> failures = new ArrayList<>();
        final List<String> ledgerFailures = new ArrayList<>();

        ExecutionCounts counts() {
            return new ExecutionCounts(found, processed, emitted, retries);
        }
    }

    private static final class ExecutionFailure extends RuntimeException {
        final ErrorCategory category;

        ExecutionFailure(ErrorCategory category, String message) {
            super(message);
            this.category = category;
        }
    }
}
