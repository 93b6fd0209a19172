package com.lbg.markets.surveillance.discovery.domain;

public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
