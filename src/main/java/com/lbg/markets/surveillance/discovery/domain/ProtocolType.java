package com.lbg.markets.surveillance.discovery.domain;

/**
 * Remote store families a configuration can poll.
 */
public enum ProtocolType {
    FTP,
    WEB,
    BLOB_STORE
}
