package com.lbg.markets.surveillance.discovery.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContinuationTokenTest {

    @Test
    void shouldDecodeWhatItEncodes() {
        ContinuationToken token = new ContinuationToken(1771804800000L, "exec|with|pipes");

        ContinuationToken decoded = ContinuationToken.decode(token.encode());

        assertEquals(token, decoded);
    }

    @Test
    void shouldBeUrlSafe() {
        String encoded = new ContinuationToken(42, "???>>>").encode();

        assertFalse(encoded.contains("+") || encoded.contains("/") || encoded.contains("="));
    }

    @Test
    void shouldRejectGarbage() {
        assertThrows(IllegalArgumentException.class, () -> ContinuationToken.decode("not base64 !"));
        assertThrows(IllegalArgumentException.class, () -> ContinuationToken.decode("bm8tc2VwYXJhdG9y"));
        assertThrows(IllegalArgumentException.class, () -> ContinuationToken.decode("YWJjfGlk"));
    }
}
