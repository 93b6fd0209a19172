package com.lbg.markets.surveillance.discovery.protocol;

import com.lbg.markets.surveillance.discovery.domain.ProtocolType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

@ApplicationScoped
public class ProtocolAdapterRegistry {

    @Inject
    FtpProtocolAdapter ftp;

    @Inject
    WebProtocolAdapter web;

    @Inject
    BlobStoreProtocolAdapter blobStore;

    public ProtocolAdapter adapterFor(ProtocolType protocol) {
        switch (protocol) {
            case FTP:
                return ftp;
            case WEB:
                return web;
            case BLOB_STORE:
                return blobStore;
            default:
                throw new IllegalArgumentException("Unsupported protocol: " + protocol);
        }
    }
}
