package com.numaansystems.mcpauth.model;

import java.time.Instant;

/**
 * Access and refresh tokens issued by the upstream identity provider.
 */
public final class UpstreamTokens {

    private final String accessToken;
    private final String refreshToken;
    private final Instant expiresAt;

    public UpstreamTokens(String accessToken, String refreshToken, Instant expiresAt) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresAt = expiresAt;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public String toString() {
        return "UpstreamTokens{expiresAt=" + expiresAt + "}";
    }
}
