package com.lbg.markets.surveillance.discovery.domain;

/**
 * Why an execution ended {@link ExecutionStatus#FAILED}.
 */
public enum ErrorCategory {
    AUTHENTICATION_FAILED,
    NETWORK_ERROR,
    PROTOCOL_ERROR,
    NOTIFICATION_FAILED,
    CANCELLED,
    LEDGER_ERROR,
    CONFIGURATION_CONFLICT,
    INTERNAL_ERROR
}
