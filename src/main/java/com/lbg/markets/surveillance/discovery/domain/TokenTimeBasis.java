package com.lbg.markets.surveillance.discovery.domain;

/**
 * Which calendar date fills {yyyy}/{mm}/{dd} tokens and keys the dedup ledger.
 */
public enum TokenTimeBasis {
    UTC,
    SCHEDULE_ZONE
}
