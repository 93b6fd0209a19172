package com.lbg.markets.surveillance.discovery.credential;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResolvedCredentialTest {

    @Test
    void shouldNeverPrintSecret() {
        ResolvedCredential credential = new ResolvedCredential("ftp-prod", "hunter2");

        assertFalse(credential.toString().contains("hunter2"));
        assertEquals("hunter2", credential.requireSecret());
    }

    @Test
    void shouldFailWhenSecretRequiredButAbsent() {
        assertFalse(ResolvedCredential.NONE.isPresent());
        assertThrows(CredentialResolutionException.class, ResolvedCredential.NONE::requireSecret);
    }
}
