package com.lbg.markets.surveillance.discovery.domain;

public enum ExecutionTrigger {
    SCHEDULED,
    MANUAL
}
