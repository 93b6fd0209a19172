package com.lbg.markets.surveillance.discovery.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Engine tunables under the {@code discovery.} prefix.
 */
@ConfigMapping(prefix = "discovery")
public interface DiscoveryConfig {

    Scheduler scheduler();

    Workers workers();

    Execution execution();

    Retry retry();

    Adapter adapter();

    Notification notification();

    ConfigUpdate configUpdate();

    Web web();

    interface Scheduler {
        /** Start the scan loop on application startup. */
        @WithDefault("true")
        boolean enabled();

        @WithDefault("10s")
        Duration tick();

        @WithDefault("5s")
        Duration initialDelay();

        /** Maximum due configurations picked up per tick. */
        @WithDefault("100")
        int batchSize();
    }

    interface Workers {
        /** Upper bound on concurrent executions, and so on outbound connections. */
        @WithDefault("8")
        int poolSize();

        @WithDefault("100")
        int queueCapacity();

        @WithDefault("30s")
        Duration shutdownGrace();
    }

    interface Execution {
        /** Budget from dispatch to completion before an execution is cancelled. */
        @WithDefault("10m")
        Duration timeout();

        /** Extra time past the deadline before the watchdog closes an abandoned record. */
        @WithDefault("2m")
        Duration abandonGrace();

        @WithDefault("30s")
        Duration watchdogInterval();
    }

    interface Retry {
        /** Total adapter attempts on network errors, first call included. */
        @WithDefault("3")
        int maxAttempts();

        @WithDefault("2s")
        Duration initialBackoff();

        @WithDefault("2.0")
        double multiplier();

        @WithDefault("30s")
        Duration maxBackoff();
    }

    interface Adapter {
        /** Listings longer than this are truncated. */
        @WithDefault("10000")
        int maxResults();
    }

    interface Notification {
        @WithDefault("5s")
        Duration ackTimeout();

        /** Event bus address that receives execution started / completed / failed events. */
        @WithDefault("discovery.executions")
        String executionEventAddress();
    }

    interface ConfigUpdate {
        @WithDefault("3")
        int maxAttempts();
    }

    interface Web {
        /** Accept http:// base URLs. Only meant for local testing. */
        @WithDefault("false")
        boolean allowPlainHttp();
    }
}
