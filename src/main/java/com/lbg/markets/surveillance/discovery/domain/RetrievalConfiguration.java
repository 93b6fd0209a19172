package com.lbg.markets.surveillance.discovery.domain;

import java.time.Instant;
import java.util.List;

/**
 * A tenant's polling job: where to look, what to match, when to run and who to tell.
 * {@code version} is the optimistic concurrency token; stores bump it on every write.
 */
public record RetrievalConfiguration(
        String tenantId,
        String configurationId,
        String name,
        String description,
        ProtocolType protocol,
        ProtocolSettings settings,
        String pathPattern,
        String namePattern,
        String extension,
        Schedule schedule,
        TokenTimeBasis tokenTimeBasis,
        boolean active,
        List<NotificationTarget> targets,
        String createdBy,
        Instant createdAt,
        String modifiedBy,
        Instant modifiedAt,
        Instant lastExecutedAt,
        Instant nextScheduledRun,
        long version
) {
    public RetrievalConfiguration {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be blank");
        }
        if (configurationId == null || configurationId.isBlank()) {
            throw new IllegalArgumentException("configurationId cannot be blank");
        }
        if (protocol == null) {
            throw new IllegalArgumentException("protocol is required");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings are required");
        }
        if (settings.protocol() != protocol) {
            throw new IllegalArgumentException("Settings of type " + settings.protocol()
                    + " do not match protocol " + protocol);
        }
        if (schedule == null) {
            throw new IllegalArgumentException("schedule is required");
        }
        if (pathPattern == null) {
            pathPattern = "";
        }
        if (namePattern == null || namePattern.isBlank()) {
            namePattern = "*";
        }
        if (tokenTimeBasis == null) {
            tokenTimeBasis = TokenTimeBasis.UTC;
        }
        targets = targets != null ? List.copyOf(targets) : List.of();
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("At least one notification target is required");
        }
        if (name == null || name.isBlank()) {
            name = configurationId;
        }
    }

    public ConfigKey key() {
        return new ConfigKey(tenantId, configurationId);
    }

    /**
     * Copy carrying the bookkeeping of a finished execution.
     */
    public RetrievalConfiguration withExecution(Instant executedAt, Instant nextRun, Instant now) {
        return new RetrievalConfiguration(tenantId, configurationId, name, description, protocol, settings,
                pathPattern, namePattern, extension, schedule, tokenTimeBasis, active, targets,
                createdBy, createdAt, "scheduler", now, executedAt, nextRun, version);
    }

    public RetrievalConfiguration withNextScheduledRun(Instant nextRun) {
        return new RetrievalConfiguration(tenantId, configurationId, name, description, protocol, settings,
                pathPattern, namePattern, extension, schedule, tokenTimeBasis, active, targets,
                createdBy, createdAt, modifiedBy, modifiedAt, lastExecutedAt, nextRun, version);
    }

    public RetrievalConfiguration deactivated(String by, Instant at) {
        return new RetrievalConfiguration(tenantId, configurationId, name, description, protocol, settings,
                pathPattern, namePattern, extension, schedule, tokenTimeBasis, false, targets,
                createdBy, createdAt, by, at, lastExecutedAt, nextScheduledRun, version);
    }

    public RetrievalConfiguration withVersion(long newVersion) {
        return new RetrievalConfiguration(tenantId, configurationId, name, description, protocol, settings,
                pathPattern, namePattern, extension, schedule, tokenTimeBasis, active, targets,
                createdBy, createdAt, modifiedBy, modifiedAt, lastExecutedAt, nextScheduledRun, newVersion);
    }
}
