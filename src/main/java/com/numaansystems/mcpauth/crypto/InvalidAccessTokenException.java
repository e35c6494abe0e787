package com.numaansystems.mcpauth.crypto;

/**
 * A bearer token could not be decrypted or failed claim validation.
 */
public class InvalidAccessTokenException extends Exception {

    public InvalidAccessTokenException(String message) {
        super(message);
    }

    public InvalidAccessTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
