package com.lbg.markets.surveillance.discovery.domain;

/**
 * Blob container settings. {@code endpoint} overrides the public account URL,
 * e.g. for a private link or an emulator.
 */
public record BlobSettings(
        String accountName,
        String containerName,
        String blobPrefix,
        BlobAuthMode authMode,
        String credentialHandle,
        String endpoint,
        int timeoutSeconds
) implements ProtocolSettings {

    public BlobSettings {
        if (accountName == null || accountName.isBlank()) {
            throw new IllegalArgumentException("Blob accountName cannot be blank");
        }
        if (containerName == null || containerName.isBlank()) {
            throw new IllegalArgumentException("Blob containerName cannot be blank");
        }
        if (authMode == null) {
            throw new IllegalArgumentException("Blob authMode is required");
        }
        if (blobPrefix == null) {
            blobPrefix = "";
        }
        if (timeoutSeconds <= 0) {
            timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        }
    }

    @Override
    public ProtocolType protocol() {
        return ProtocolType.BLOB_STORE;
    }
}
