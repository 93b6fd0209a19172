package com.lbg.markets.surveillance.discovery.domain;

public enum BlobAuthMode {
    /** Shared account key, resolved from the credential handle. */
    ACCOUNT_KEY,
    /** Delegation (SAS) token, resolved from the credential handle. */
    SAS_TOKEN,
    /** Full connection string, resolved from the credential handle. */
    CONNECTION_STRING
}
