package com.lbg.markets.surveillance.discovery.domain;

/**
 * Tenant-scoped identity of a retrieval configuration.
 */
public record ConfigKey(String tenantId, String configurationId) {
    public ConfigKey {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be blank");
        }
        if (configurationId == null || configurationId.isBlank()) {
            throw new IllegalArgumentException("configurationId cannot be blank");
        }
    }

    @Override
    public String toString() {
        return tenantId + "/" + configurationId;
    }
}
