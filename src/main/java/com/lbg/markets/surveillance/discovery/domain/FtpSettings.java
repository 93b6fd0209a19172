package com.lbg.markets.surveillance.discovery.domain;

/**
 * FTP / explicit FTPS connection settings.
 */
public record FtpSettings(
        String host,
        int port,
        String username,
        String credentialHandle,
        boolean useTls,
        boolean passiveMode,
        int timeoutSeconds
) implements ProtocolSettings {

    public static final int DEFAULT_PORT = 21;

    public FtpSettings {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("FTP host cannot be blank");
        }
        if (port == 0) {
            port = DEFAULT_PORT;
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("FTP port out of range: " + port);
        }
        if (username == null || username.isBlank()) {
            username = "anonymous";
        }
        if (timeoutSeconds <= 0) {
            timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        }
    }

    @Override
    public ProtocolType protocol() {
        return ProtocolType.FTP;
    }
}
