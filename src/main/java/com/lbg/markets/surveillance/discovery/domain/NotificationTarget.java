package com.lbg.markets.surveillance.discovery.domain;

import java.util.Map;

/**
 * A downstream notification or command emitted for every newly discovered file.
 * When {@code destination} is blank the type name is used as the address.
 */
public record NotificationTarget(
        DeliveryMode mode,
        String typeName,
        String destination,
        Map<String, Object> payload
) {
    public NotificationTarget {
        if (mode == null) {
            throw new IllegalArgumentException("Notification mode is required");
        }
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("Notification typeName cannot be blank");
        }
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public String address() {
        return destination != null && !destination.isBlank() ? destination : typeName;
    }

    public static NotificationTarget broadcast(String typeName) {
        return new NotificationTarget(DeliveryMode.BROADCAST, typeName, null, Map.of());
    }

    public static NotificationTarget directed(String typeName, String destination) {
        return new NotificationTarget(DeliveryMode.DIRECTED, typeName, destination, Map.of());
    }
}
