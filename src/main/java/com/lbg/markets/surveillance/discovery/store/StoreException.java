package com.lbg.markets.surveillance.discovery.store;

/**
 * A persistence call failed. Wraps the underlying {@link java.sql.SQLException}.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
