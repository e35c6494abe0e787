package com.numaansystems.mcpauth.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * PKCE (RFC 7636) helpers. Only the S256 method is supported.
 */
public final class Pkce {

    public static final String METHOD_S256 = "S256";

    private Pkce() {
    }

    /**
     * base64url(sha256(verifier)) without padding.
     */
    public static String challengeFor(String verifier) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Checks a verifier against a stored challenge in constant time.
     */
    public static boolean verify(String verifier, String expectedChallenge) {
        if (verifier == null || verifier.isEmpty()) {
            return false;
        }
        return SecretComparator.matches(challengeFor(verifier), expectedChallenge);
    }
}
