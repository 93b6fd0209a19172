package com.lbg.markets.surveillance.discovery.orchestration;

import com.lbg.markets.surveillance.discovery.credential.CredentialResolver;
import com.lbg.markets.surveillance.discovery.credential.ResolvedCredential;
import com.lbg.markets.surveillance.discovery.domain.ConfigKey;
import com.lbg.markets.surveillance.discovery.domain.ExecutionTrigger;
import com.lbg.markets.surveillance.discovery.domain.RetrievalConfiguration;
import com.lbg.markets.surveillance.discovery.protocol.ProtocolException;
import com.lbg.markets.surveillance.discovery.protocol.ProtocolAdapterRegistry;
import com.lbg.markets.surveillance.discovery.store.ConfigurationStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Operator entry points: run a configuration now, stop it, or check that its endpoint is reachable.
 */
@ApplicationScoped
public class DiscoveryService {

    private static final Logger LOG = Logger.getLogger(DiscoveryService.class);

    @Inject
    ConfigurationStore configurationStore;

    @Inject
    ExecutionDispatcher dispatcher;

    @Inject
    ProtocolAdapterRegistry adapters;

    @Inject
    CredentialResolver credentialResolver;

    /**
     * Queues a MANUAL execution outside the schedule.
     *
     * @return the new execution id
     * @throws ExecutionAlreadyRunningException if the configuration already has an execution in flight
     * @throws IllegalStateException if the configuration is inactive
     */
    public String trigger(String tenantId, String configurationId) {
        ConfigKey key = new ConfigKey(tenantId, configurationId);
        RetrievalConfiguration configuration = configurationStore.get(key);
        if (!configuration.active()) {
            throw new IllegalStateException("Configuration " + key + " is inactive");
        }
        String executionId = dispatcher.dispatch(key, ExecutionTrigger.MANUAL)
                .orElseThrow(() -> new ExecutionAlreadyRunningException(key,
                        dispatcher.inFlightExecution(key).orElse("unknown")));
        LOG.infof("Manual execution %s queued for %s", executionId, key);
        return executionId;
    }

    /**
     * @return false if nothing was in flight for the configuration
     */
    public boolean cancel(String tenantId, String configurationId) {
        return dispatcher.cancel(new ConfigKey(tenantId, configurationId), "cancelled by operator");
    }

    /**
     * Connects and authenticates against the configuration's endpoint without listing.
     */
    public void testConnection(String tenantId, String configurationId) throws ProtocolException {
        RetrievalConfiguration configuration = configurationStore.get(new ConfigKey(tenantId, configurationId));
        ResolvedCredential credential = credentialResolver.resolve(configuration.settings().credentialHandle());
        adapters.adapterFor(configuration.protocol()).testConnection(configuration.settings(), credential);
        LOG.infof("Connection test for %s succeeded", configuration.key());
    }
}
