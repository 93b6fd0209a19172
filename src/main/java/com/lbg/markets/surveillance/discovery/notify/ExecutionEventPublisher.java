package com.lbg.markets.surveillance.discovery.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.surveillance.discovery.config.DiscoveryConfig;
import com.lbg.markets.surveillance.discovery.domain.ExecutionRecord;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Broadcasts execution lifecycle events. Publishing is best effort: a failure is logged
 * and never changes the outcome of the execution.
 */
@ApplicationScoped
public class ExecutionEventPublisher {

    private static final Logger LOG = Logger.getLogger(ExecutionEventPublisher.class);

    @Inject
    EventBus eventBus;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    DiscoveryConfig config;

    @Inject
    Clock clock;

    public void publish(ExecutionRecord record) {
        ExecutionEvent event = ExecutionEvent.of(record, clock.instant());
        String address = config.notification().executionEventAddress();
        try {
            eventBus.publish(address, objectMapper.writeValueAsString(event),
                    new DeliveryOptions().addHeader(EventBusNotificationTransport.HEADER_TYPE, event.eventType()));
            LOG.debugf("Published %s for execution %s", event.eventType(), event.executionId());
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.warnf(e, "Could not publish %s for execution %s", event.eventType(), event.executionId());
        }
    }
}
