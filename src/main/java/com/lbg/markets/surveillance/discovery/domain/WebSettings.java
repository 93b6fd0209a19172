package com.lbg.markets.surveillance.discovery.domain;

/**
 * HTTPS endpoint settings. The resolved path pattern is appended to {@code baseUrl}.
 */
public record WebSettings(
        String baseUrl,
        WebAuthMode authMode,
        String username,
        String credentialHandle,
        String apiKeyHeader,
        boolean followRedirects,
        int timeoutSeconds
) implements ProtocolSettings {

    public static final String DEFAULT_API_KEY_HEADER = "X-API-Key";

    public WebSettings {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Web baseUrl cannot be blank");
        }
        if (authMode == null) {
            authMode = WebAuthMode.NONE;
        }
        if (apiKeyHeader == null || apiKeyHeader.isBlank()) {
            apiKeyHeader = DEFAULT_API_KEY_HEADER;
        }
        if (timeoutSeconds <= 0) {
            timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        }
    }

    @Override
    public ProtocolType protocol() {
        return ProtocolType.WEB;
    }
}
