package com.numaansystems.mcpauth.model;

import java.time.Instant;
import java.util.List;

/**
 * Authorization request waiting for the upstream identity provider to call back.
 * Keyed in its store by the correlation token sent upstream as {@code state}.
 */
public final class PendingAuthorization {

    private final String clientId;
    private final String redirectUri;
    private final String codeChallenge;
    private final String codeChallengeMethod;
    private final String state;
    private final List<String> scopes;
    private final String upstreamClientId;
    private final Instant createdAt;

    public PendingAuthorization(String clientId, String redirectUri, String codeChallenge,
                                String codeChallengeMethod, String state, List<String> scopes,
                                String upstreamClientId, Instant createdAt) {
        this.clientId = clientId;
        this.redirectUri = redirectUri;
        this.codeChallenge = codeChallenge;
        this.codeChallengeMethod = codeChallengeMethod;
        this.state = state;
        this.scopes = scopes == null ? List.of() : List.copyOf(scopes);
        this.upstreamClientId = upstreamClientId;
        this.createdAt = createdAt;
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

    public String getCodeChallengeMethod() {
        return codeChallengeMethod;
    }

    /** The caller's own state, returned unchanged on the final redirect. */
    public String getState() {
        return state;
    }

    public List<String> getScopes() {
        return scopes;
    }

    public String getUpstreamClientId() {
        return upstreamClientId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
