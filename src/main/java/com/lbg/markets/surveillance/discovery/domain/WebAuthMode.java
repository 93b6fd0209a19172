package com.lbg.markets.surveillance.discovery.domain;

public enum WebAuthMode {
    NONE,
    BASIC,
    BEARER,
    API_KEY
}
