package com.lbg.markets.surveillance.discovery.orchestration;

import com.lbg.markets.surveillance.discovery.domain.ConfigKey;

public class ExecutionAlreadyRunningException extends RuntimeException {

    private final String runningExecutionId;

    public ExecutionAlreadyRunningException(ConfigKey key, String runningExecutionId) {
        super("Configuration " + key + " already has execution " + runningExecutionId + " in flight");
        this.runningExecutionId = runningExecutionId;
    }

    public String runningExecutionId() {
        return runningExecutionId;
    }
}
