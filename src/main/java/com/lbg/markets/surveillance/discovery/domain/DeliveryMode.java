package com.lbg.markets.surveillance.discovery.domain;

public enum DeliveryMode {
    /** Published to every subscriber of the address, no acknowledgement. */
    BROADCAST,
    /** Sent to one consumer of the address, which must acknowledge. */
    DIRECTED
}
