package com.numaansystems.mcpauth.model;

import java.time.Instant;
import java.util.List;

/**
 * Single-use code handed to the client after a successful upstream login. Bound to the
 * client, its redirect URI and the PKCE challenge recorded at authorize time.
 */
public final class AuthorizationCode {

    private final String clientId;
    private final String redirectUri;
    private final String codeChallenge;
    private final List<String> scopes;
    private final String targetUrl;
    private final UpstreamSession session;
    private final UpstreamTokens tokens;
    private final String upstreamClientId;
    private final Instant issuedAt;

    public AuthorizationCode(String clientId, String redirectUri, String codeChallenge, List<String> scopes,
                             String targetUrl, UpstreamSession session, UpstreamTokens tokens,
                             String upstreamClientId, Instant issuedAt) {
        this.clientId = clientId;
        this.redirectUri = redirectUri;
        this.codeChallenge = codeChallenge;
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

    public String getRedirectUri() {
        return redirectUri;
    }

    public String getCodeChallenge() {
        return codeChallenge;
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
}
