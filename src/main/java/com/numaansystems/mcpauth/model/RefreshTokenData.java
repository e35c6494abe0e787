package com.numaansystems.mcpauth.model;

import java.time.Instant;
import java.util.List;

/**
 * Server-side state behind an opaque refresh token.
 */
public final class RefreshTokenData {

    private final String clientId;
    private final List<String> scopes;
    private final String targetUrl;
    private final UpstreamSession session;
    private final UpstreamTokens tokens;
    private final String upstreamClientId;
    private final Instant issuedAt;

    public RefreshTokenData(String clientId, List<String> scopes, String targetUrl, UpstreamSession session,
                            UpstreamTokens tokens, String upstreamClientId, Instant issuedAt) {
        this.clientId = clientId;
        this.scopes = scopes == null ? List.of() : List.copyOf(scopes);
        this.targetUrl = targetUrl;
        this.session = session;
        this.tokens = tokens;
        this.upstreamClientId = upstreamClientId;
        this.issuedAt = issuedAt;
    }

    public String getClientId() {
        return clientId;
    }

    public String getSubject() {
        return session.getUserName();
    }

    public List<String> getScopes() {
        return scopes;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public UpstreamSession getSession() {
        return session;
    }

    public UpstreamTokens getTokens() {
        return tokens;
    }

    public String getUpstreamClientId() {
        return upstreamClientId;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    /**
     * Copy carrying refreshed upstream tokens, used when the refresh token is rotated.
     */
    public RefreshTokenData withTokens(UpstreamTokens newTokens, Instant rotatedAt) {
        return new RefreshTokenData(clientId, scopes, targetUrl, session, newTokens, upstreamClientId, rotatedAt);
    }
}
