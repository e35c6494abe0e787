package com.numaansystems.mcpauth.crypto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PkceTest {

    @Test
    @DisplayName("Should compute the RFC 7636 appendix B challenge")
    void testRfcExample() {
        String verifier = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";

        assertEquals("E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM", Pkce.challengeFor(verifier));
    }

    @Test
    @DisplayName("Should verify the verifier a challenge was derived from")
    void testVerifyRoundTrip() {
        String verifier = RandomTokens.generate();

        assertTrue(Pkce.verify(verifier, Pkce.challengeFor(verifier)));
    }

    @Test
    @DisplayName("Should reject any other verifier")
    void testVerifyMismatch() {
        String challenge = Pkce.challengeFor(RandomTokens.generate());

        assertFalse(Pkce.verify(RandomTokens.generate(), challenge));
        assertFalse(Pkce.verify("", challenge));
        assertFalse(Pkce.verify(null, challenge));
    }
}
