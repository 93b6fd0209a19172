package com.lbg.markets.surveillance.discovery.orchestration;

public class ExecutionCancelledException extends RuntimeException {

    public ExecutionCancelledException(String message) {
        super(message);
    }
}
