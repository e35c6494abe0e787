package com.numaansystems.mcpauth.security;

import com.numaansystems.mcpauth.model.AccessTokenClaims;
import jakarta.servlet.http.HttpServletRequest;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Identity of the caller behind a validated bearer token, exposed to MCP tool handlers.
 *
 * <p>Available as a request attribute under {@link #REQUEST_ATTRIBUTE} and as the
 * principal of the Spring Security {@code Authentication}.</p>
 */
public final class AuthInfo {

    public static final String REQUEST_ATTRIBUTE = AuthInfo.class.getName();

    private final String clientId;
    private final String subject;
    private final List<String> scopes;
    private final String siteId;
    private final String targetUrl;
    private final String upstreamUserId;
    private final String upstreamAccessToken;
    private final Instant expiresAt;

    public AuthInfo(String clientId, String subject, List<String> scopes, String siteId, String targetUrl,
                    String upstreamUserId, String upstreamAccessToken, Instant expiresAt) {
        this.clientId = clientId;
        this.subject = subject;
        this.scopes = scopes == null ? List.of() : List.copyOf(scopes);
        this.siteId = siteId;
        this.targetUrl = targetUrl;
        this.upstreamUserId = upstreamUserId;
        this.upstreamAccessToken = upstreamAccessToken;
        this.expiresAt = expiresAt;
    }

    static AuthInfo from(AccessTokenClaims claims) {
        return new AuthInfo(claims.getClientId(), claims.getSubject(), claims.getScopes(), claims.getSiteId(),
                claims.getTargetUrl(), claims.getUpstreamUserId(), claims.getUpstreamAccessToken(),
                claims.getExpiresAt());
    }

    /**
     * The caller of the current request, when the bearer middleware admitted it.
     */
    public static Optional<AuthInfo> current(HttpServletRequest request) {
        Object value = request.getAttribute(REQUEST_ATTRIBUTE);
        return value instanceof AuthInfo authInfo ? Optional.of(authInfo) : Optional.empty();
    }

    public String getClientId() {
        return clientId;
    }

    public String getSubject() {
        return subject;
    }

    public List<String> getScopes() {
        return scopes;
    }

    public String getSiteId() {
        return siteId;
    }

    /** Base URL of the Tableau deployment the upstream token belongs to. */
    public String getTargetUrl() {
        return targetUrl;
    }

    public String getUpstreamUserId() {
        return upstreamUserId;
    }

    /** Null for client-credentials callers. */
    public String getUpstreamAccessToken() {
        return upstreamAccessToken;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public String toString() {
        return "AuthInfo{clientId='" + clientId + "', subject='" + subject + "', scopes=" + scopes
                + ", siteId='" + siteId + "'}";
    }
}
