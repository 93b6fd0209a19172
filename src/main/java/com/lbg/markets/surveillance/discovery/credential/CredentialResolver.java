package com.lbg.markets.surveillance.discovery.credential;

/**
 * Turns an opaque secret handle into live secret material at call time.
 */
public interface CredentialResolver {

    /**
     * @param handle handle from the protocol settings, may be null for anonymous access
     * @throws CredentialResolutionException if a handle is given but cannot be resolved
     */
    ResolvedCredential resolve(String handle);
}
