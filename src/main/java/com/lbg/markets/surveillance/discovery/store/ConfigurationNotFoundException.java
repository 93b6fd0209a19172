package com.lbg.markets.surveillance.discovery.store;

import com.lbg.markets.surveillance.discovery.domain.ConfigKey;

public class ConfigurationNotFoundException extends RuntimeException {

    private final ConfigKey key;

    public ConfigurationNotFoundException(ConfigKey key) {
        super("Configuration not found: " + key);
        this.key = key;
    }

    public ConfigKey key() {
        return key;
    }
}
