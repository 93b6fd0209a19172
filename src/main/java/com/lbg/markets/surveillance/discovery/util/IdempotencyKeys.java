package com.lbg.markets.surveillance.discovery.util;

import com.lbg.markets.surveillance.discovery.domain.DeliveryMode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;

/**
 * Stable keys consumers use to drop redelivered notifications.
 * The key of a file is {@code tenant:configuration:locator:discoveryDate};
 * directed commands get a {@code :cmd} suffix.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
        // Utility class
    }

    public static String forFile(String tenantId, String configurationId, String locator, LocalDate discoveryDate) {
        return tenantId + ":" + configurationId + ":" + locator + ":" + discoveryDate;
    }

    public static String forTarget(String fileKey, DeliveryMode mode) {
        return mode == DeliveryMode.DIRECTED ? fileKey + ":cmd" : fileKey;
    }

    /**
     * Deterministic message id, so a redelivered notification carries the same id.
     * SHA-256 of the idempotency key and the notification type.
     */
    public static String messageId(String idempotencyKey, String typeName) {
        String identity = idempotencyKey + "|" + typeName;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(identity.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
