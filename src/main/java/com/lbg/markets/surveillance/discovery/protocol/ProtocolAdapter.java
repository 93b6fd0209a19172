package com.lbg.markets.surveillance.discovery.protocol;

import com.lbg.markets.surveillance.discovery.credential.ResolvedCredential;
import com.lbg.markets.surveillance.discovery.domain.DiscoveredFile;
import com.lbg.markets.surveillance.discovery.domain.ProtocolSettings;
import com.lbg.markets.surveillance.discovery.domain.ProtocolType;

import java.util.List;

/**
 * Lists remote files for one protocol family.
 * Implementations bound every call by the settings' timeout and never log secret material.
 */
public interface ProtocolAdapter {

    ProtocolType protocol();

    /**
     * Files under the resolved path whose names match the pattern and extension,
     * in listing order, at most {@code request.maxResults()} of them.
     */
    List<DiscoveredFile> list(ProtocolSettings settings, ListingRequest request, ResolvedCredential credential)
            throws ProtocolException;

    /**
     * Connects and authenticates without listing.
     */
    void testConnection(ProtocolSettings settings, ResolvedCredential credential) throws ProtocolException;
}
