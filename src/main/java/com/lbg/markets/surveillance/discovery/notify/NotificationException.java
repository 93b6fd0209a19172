package com.lbg.markets.surveillance.discovery.notify;

/**
 * A notification could not be handed over, or a command was not acknowledged.
 */
public class NotificationException extends Exception {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
