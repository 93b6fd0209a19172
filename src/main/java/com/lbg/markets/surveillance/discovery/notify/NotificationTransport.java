package com.lbg.markets.surveillance.discovery.notify;

import com.lbg.markets.surveillance.discovery.domain.NotificationTarget;

/**
 * At-least-once delivery of discovery notifications to downstream consumers.
 */
public interface NotificationTransport {

    /**
     * Emits one notification. Broadcasts return once handed to the transport;
     * directed commands return once a consumer acknowledged them.
     */
    void deliver(NotificationTarget target, FileDiscoveredNotification notification) throws NotificationException;
}
