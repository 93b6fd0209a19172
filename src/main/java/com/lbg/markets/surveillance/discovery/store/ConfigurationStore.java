package com.lbg.markets.surveillance.discovery.store;

import com.lbg.markets.surveillance.discovery.domain.ConfigKey;
import com.lbg.markets.surveillance.discovery.domain.Page;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of retrieval configurations. Configurations are never deleted, only deactivated.
 */
public interface ConfigurationStore {

    /**
     * Validates and stores a new configuration at version 1, with its first
     * {@code nextScheduledRun} computed from the schedule.
     *
     * @throws ValidationException if the configuration is invalid
     */
    RetrievalConfiguration create(RetrievalConfiguration configuration);

    Optional<RetrievalConfiguration> find(ConfigKey key);

    default RetrievalConfiguration get(ConfigKey key) {
        return find(key).orElseThrow(() -> new ConfigurationNotFoundException(key));
    }

    Page<RetrievalConfiguration> list(String tenantId, int pageSize, String continuationToken);

    /**
     * Active configurations whose {@code nextScheduledRun} is at or before {@code now},
     * most overdue first.
     */
    List<RetrievalConfiguration> findDue(Instant now, int limit);

    /**
     * Writes the configuration if the stored version still equals {@code configuration.version()}.
     *
     * @return the stored configuration with its new version
     * @throws ConcurrencyConflictException if the stored version moved on
     * @throws ConfigurationNotFoundException if it does not exist
     */
    RetrievalConfiguration update(RetrievalConfiguration configuration);

    RetrievalConfiguration deactivate(ConfigKey key, String modifiedBy);
}
