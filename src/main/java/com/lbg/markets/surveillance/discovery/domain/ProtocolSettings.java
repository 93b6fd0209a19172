package com.lbg.markets.surveillance.discovery.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Connection settings for one protocol. The concrete type must match the
 * configuration's {@link ProtocolType}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FtpSettings.class, name = "FTP"),
        @JsonSubTypes.Type(value = WebSettings.class, name = "WEB"),
        @JsonSubTypes.Type(value = BlobSettings.class, name = "BLOB_STORE")
})
public interface ProtocolSettings {

    int DEFAULT_TIMEOUT_SECONDS = 30;

    ProtocolType protocol();

    /**
     * Opaque handle passed to the credential resolver, or null when the
     * endpoint needs no secret.
     */
    String credentialHandle();

    int timeoutSeconds();
}
