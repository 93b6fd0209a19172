package com.lbg.markets.surveillance.discovery.store;

import com.lbg.markets.surveillance.discovery.domain.ConfigKey;

/**
 * The configuration was written by someone else since it was read.
 */
public class ConcurrencyConflictException extends RuntimeException {

    private final ConfigKey key;
    private final long expectedVersion;

    public ConcurrencyConflictException(ConfigKey key, long expectedVersion) {
        super("Configuration " + key + " no longer at version " + expectedVersion);
        this.key = key;
        this.expectedVersion = expectedVersion;
    }

    public ConfigKey key() {
        return key;
    }

    public long expectedVersion() {
        return expectedVersion;
    }
}
