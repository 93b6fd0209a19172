package com.lbg.markets.surveillance.discovery.util;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Opaque keyset cursor: the sort timestamp and id of the last row of a page.
 */
public record ContinuationToken(long timestampMillis, String id) {

    public ContinuationToken {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Continuation id cannot be blank");
        }
    }

    public String encode() {
        String raw = timestampMillis + "|" + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static ContinuationToken decode(String token) {
        String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed continuation token", e);
        }
        int sep = raw.indexOf('|');
        if (sep <= 0 || sep == raw.length() - 1) {
            throw new IllegalArgumentException("Malformed continuation token");
        }
        try {
            return new ContinuationToken(Long.parseLong(raw.substring(0, sep)), raw.substring(sep + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed continuation token", e);
        }
    }
}
