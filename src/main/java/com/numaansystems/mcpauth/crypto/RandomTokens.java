package com.numaansystems.mcpauth.crypto;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Opaque random identifiers: correlation tokens, authorization codes, refresh tokens,
 * client ids and client secrets.
 */
public final class RandomTokens {

    private static final SecureRandom RANDOM = new SecureRandom();

    private RandomTokens() {
    }

    /**
     * 256 bits of randomness, hex-encoded.
     */
    public static String generate() {
        return generate(32);
    }

    public static String generate(int byteLength) {
        byte[] bytes = new byte[byteLength];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
