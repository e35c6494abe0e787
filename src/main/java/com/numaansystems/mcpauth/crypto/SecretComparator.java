package com.numaansystems.mcpauth.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;

/**
 * Constant-time comparison of secrets whose lengths may differ.
 *
 * <p>Both sides are first run through HMAC-SHA256 under a random per-process key, so the
 * final {@link MessageDigest#isEqual(byte[], byte[])} always compares two 32-byte values.
 * The time taken does not depend on where the inputs differ or on whether their lengths
 * differ.</p>
 */
public final class SecretComparator {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final byte[] COMPARISON_KEY = generateKey();

    private SecretComparator() {
    }

    /**
     * Returns true only when both values are non-null and equal.
     */
    public static boolean matches(String provided, String expected) {
        byte[] providedDigest = digest(provided == null ? "" : provided);
        byte[] expectedDigest = digest(expected == null ? "" : expected);
        boolean equal = MessageDigest.isEqual(providedDigest, expectedDigest);
        return equal & provided != null & expected != null;
    }

    private static byte[] digest(String value) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(COMPARISON_KEY, HMAC_ALGORITHM));
            return mac.doFinal(value.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }

    private static byte[] generateKey() {
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        return key;
    }
}
