package com.numaansystems.mcpauth.crypto;

/**
 * The JWE private key could not be loaded. Raised during startup only; the message never
 * contains key material.
 */
public class KeyLoadingException extends IllegalStateException {

    public KeyLoadingException(String message) {
        super(message);
    }

    public KeyLoadingException(String message, Throwable cause) {
        super(message, cause);
    }
}
