package com.lbg.markets.surveillance.discovery.protocol;

/**
 * One listing call with all date tokens already resolved.
 */
public record ListingRequest(
        String resolvedPath,
        String namePattern,
        String extension,
        int maxResults
) {
    public ListingRequest {
        if (resolvedPath == null) {
            resolvedPath = "";
        }
        if (namePattern == null || namePattern.isBlank()) {
            namePattern = "*";
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive");
        }
    }
}
