package com.lbg.markets.surveillance.discovery.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.surveillance.discovery.config.DiscoveryConfig;
import com.lbg.markets.surveillance.discovery.domain.DeliveryMode;
import com.lbg.markets.surveillance.discovery.domain.NotificationTarget;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.ReplyException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers notifications over the Vert.x event bus as JSON strings.
 * Broadcasts are published to every consumer of the address; directed commands are
 * sent point-to-point and wait for a reply within the acknowledgement timeout.
 */
@ApplicationScoped
public class EventBusNotificationTransport implements NotificationTransport {

    private static final Logger LOG = Logger.getLogger(EventBusNotificationTransport.class);

    public static final String HEADER_TYPE = "notification-type";
    public static final String HEADER_IDEMPOTENCY_KEY = "idempotency-key";
    public static final String HEADER_MESSAGE_ID = "message-id";

    @Inject
    EventBus eventBus;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    DiscoveryConfig config;

    @Override
    public void deliver(NotificationTarget target, FileDiscoveredNotification notification)
            throws NotificationException {
        String body = serialize(notification);
        long ackTimeoutMillis = config.notification().ackTimeout().toMillis();
        DeliveryOptions options = new DeliveryOptions()
                .addHeader(HEADER_TYPE, notification.typeName())
                .addHeader(HEADER_IDEMPOTENCY_KEY, notification.idempotencyKey())
                .addHeader(HEADER_MESSAGE_ID, notification.messageId())
                .setSendTimeout(ackTimeoutMillis);

        if (target.mode() == DeliveryMode.BROADCAST) {
            eventBus.publish(target.address(), body, options);
            LOG.debugf("Published %s for %s to %s", notification.typeName(), notification.filename(), target.address());
            return;
        }

        try {
            eventBus.request(target.address(), body, options)
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(ackTimeoutMillis + 1000, TimeUnit.MILLISECONDS);
            LOG.debugf("Command %s for %s acknowledged by %s",
                    notification.typeName(), notification.filename(), target.address());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ReplyException) {
                ReplyException reply = (ReplyException) cause;
                throw new NotificationException("Command " + notification.typeName() + " to " + target.address()
                        + " not acknowledged (" + reply.failureType() + "): " + reply.getMessage(), reply);
            }
            throw new NotificationException("Command " + notification.typeName() + " to " + target.address()
                    + " failed: " + cause, cause);
        } catch (TimeoutException e) {
            throw new NotificationException("Command " + notification.typeName() + " to " + target.address()
                    + " timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted waiting for acknowledgement from " + target.address(), e);
        }
    }

    private String serialize(FileDiscoveredNotification notification) throws NotificationException {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new NotificationException("Cannot serialise notification " + notification.messageId(), e);
        }
    }
}
