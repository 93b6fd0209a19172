package com.lbg.markets.surveillance.discovery.credential;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/**
 * Resolves {@code secrets.<handle>} through MicroProfile Config on every call,
 * so values supplied by environment variables or a vault config source are always current.
 */
@ApplicationScoped
public class ConfigCredentialResolver implements CredentialResolver {

    private static final Logger LOG = Logger.getLogger(ConfigCredentialResolver.class);

    static final String PREFIX = "secrets.";

    @Inject
    Config config;

    @Override
    public ResolvedCredential resolve(String handle) {
        if (handle == null || handle.isBlank()) {
            return ResolvedCredential.NONE;
        }
        String secret = config.getOptionalValue(PREFIX + handle, String.class)
                .orElseThrow(() -> new CredentialResolutionException("Unknown secret handle: " + handle));
        LOG.debugf("Resolved secret handle %s", handle);
        return new ResolvedCredential(handle, secret);
    }
}
