package com.lbg.markets.surveillance.discovery.credential;

/**
 * Live secret material for one execution. Never cached, never printed.
 */
public record ResolvedCredential(String handle, String secret) {

    public static final ResolvedCredential NONE = new ResolvedCredential(null, null);

    public boolean isPresent() {
        return secret != null && !secret.isEmpty();
    }

    /**
     * The secret, failing when the handle resolved to nothing.
     */
    public String requireSecret() {
        if (!isPresent()) {
            throw new CredentialResolutionException("No secret available for handle: " + handle);
        }
        return secret;
    }

    @Override
    public String toString() {
        return "ResolvedCredential[handle=" + handle + ", secret=" + (isPresent() ? "****" : "<none>") + "]";
    }
}
