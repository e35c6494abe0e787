package com.numaansystems.mcpauth.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful token endpoint response (RFC 6749 section 5.1).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TokenResponse {

    public static final String TOKEN_TYPE_BEARER = "Bearer";

    @JsonProperty("access_token")
    private final String accessToken;

    @JsonProperty("token_type")
    private final String tokenType = TOKEN_TYPE_BEARER;

    @JsonProperty("expires_in")
    private final long expiresIn;

    @JsonProperty("refresh_token")
    private final String refreshToken;

    @JsonProperty("scope")
    private final String scope;

    public TokenResponse(String accessToken, long expiresIn, String refreshToken, String scope) {
        this.accessToken = accessToken;
        this.expiresIn = expiresIn;
        this.refreshToken = refreshToken;
        this.scope = scope;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public long getExpiresIn() {
        return expiresIn;
    }

    /** Null for the client-credentials grant. */
    public String getRefreshToken() {
        return refreshToken;
    }

    public String getScope() {
        return scope;
    }
}
