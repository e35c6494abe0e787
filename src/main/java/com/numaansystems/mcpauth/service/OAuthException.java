package com.numaansystems.mcpauth.service;

import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;

/**
 * OAuth error answered directly to the caller as {@code {error, error_description}} JSON.
 *
 * <p>Error codes come from the RFC 6749 vocabulary in {@link OAuth2ErrorCodes}, plus the
 * RFC 7591 registration errors defined here.</p>
 */
public class OAuthException extends RuntimeException {

    public static final String INVALID_REDIRECT_URI = "invalid_redirect_uri";
    public static final String INVALID_CLIENT_METADATA = "invalid_client_metadata";

    private final String error;
    private final HttpStatus status;

    public OAuthException(String error, String description, HttpStatus status) {
        super(description);
        this.error = error;
        this.status = status;
    }

    public static OAuthException invalidRequest(String description) {
        return new OAuthException(OAuth2ErrorCodes.INVALID_REQUEST, description, HttpStatus.BAD_REQUEST);
    }

    public static OAuthException invalidClient(String description) {
        return new OAuthException(OAuth2ErrorCodes.INVALID_CLIENT, description, HttpStatus.UNAUTHORIZED);
    }

    public static OAuthException invalidGrant(String description) {
        return new OAuthException(OAuth2ErrorCodes.INVALID_GRANT, description, HttpStatus.BAD_REQUEST);
    }

    public static OAuthException serverError(String description) {
        return new OAuthException(OAuth2ErrorCodes.SERVER_ERROR, description, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    public String getError() {
        return error;
    }

    public String getDescription() {
        return getMessage();
    }

    public HttpStatus getStatus() {
        return status;
    }
}
