package com.numaansystems.mcpauth.model;

import java.time.Instant;
import java.util.List;

/**
 * Claim set carried, encrypted, inside a bearer access token.
 *
 * <p>Upstream fields are absent for client-credentials tokens, which are not tied to a
 * user's upstream session.</p>
 */
public final class AccessTokenClaims {

    private final String issuer;
    private final String audience;
    private final String subject;
    private final String clientId;
    private final List<String> scopes;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final String siteId;
    private final String targetUrl;
    private final String upstreamUserId;
    private final String upstreamAccessToken;
    private final String upstreamRefreshToken;
    private final Instant upstreamExpiresAt;

    private AccessTokenClaims(Builder builder) {
        this.issuer = builder.issuer;
        this.audience = builder.audience;
        this.subject = builder.subject;
        this.clientId = builder.clientId;
        this.scopes = builder.scopes == null ? List.of() : List.copyOf(builder.scopes);
        this.issuedAt = builder.issuedAt;
        this.expiresAt = builder.expiresAt;
        this.siteId = builder.siteId;
        this.targetUrl = builder.targetUrl;
        this.upstreamUserId = builder.upstreamUserId;
        this.upstreamAccessToken = builder.upstreamAccessToken;
        this.upstreamRefreshToken = builder.upstreamRefreshToken;
        this.upstreamExpiresAt = builder.upstreamExpiresAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getIssuer() {
        return issuer;
    }

    public String getAudience() {
        return audience;
    }

    public String getSubject() {
        return subject;
    }

    public String getClientId() {
        return clientId;
    }

    public List<String> getScopes() {
        return scopes;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public String getSiteId() {
        return siteId;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public String getUpstreamUserId() {
        return upstreamUserId;
    }

    public String getUpstreamAccessToken() {
        return upstreamAccessToken;
    }

    public String getUpstreamRefreshToken() {
        return upstreamRefreshToken;
    }

    public Instant getUpstreamExpiresAt() {
        return upstreamExpiresAt;
    }

    public static final class Builder {
        private String issuer;
        private String audience;
        private String subject;
        private String clientId;
        private List<String> scopes;
        private Instant issuedAt;
        private Instant expiresAt;
        private String siteId;
        private String targetUrl;
        private String upstreamUserId;
        private String upstreamAccessToken;
        private String upstreamRefreshToken;
        private Instant upstreamExpiresAt;

        private Builder() {
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder audience(String audience) {
            this.audience = audience;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder scopes(List<String> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder siteId(String siteId) {
            this.siteId = siteId;
            return this;
        }

        public Builder targetUrl(String targetUrl) {
            this.targetUrl = targetUrl;
            return this;
        }

        public Builder upstreamUserId(String upstreamUserId) {
            this.upstreamUserId = upstreamUserId;
            return this;
        }

        public Builder upstreamTokens(UpstreamTokens tokens) {
            if (tokens != null) {
                this.upstreamAccessToken = tokens.getAccessToken();
                this.upstreamRefreshToken = tokens.getRefreshToken();
                this.upstreamExpiresAt = tokens.getExpiresAt();
            }
            return this;
        }

        public Builder upstreamAccessToken(String upstreamAccessToken) {
            this.upstreamAccessToken = upstreamAccessToken;
            return this;
        }

        public Builder upstreamRefreshToken(String upstreamRefreshToken) {
            this.upstreamRefreshToken = upstreamRefreshToken;
            return this;
        }

        public Builder upstreamExpiresAt(Instant upstreamExpiresAt) {
            this.upstreamExpiresAt = upstreamExpiresAt;
            return this;
        }

        public AccessTokenClaims build() {
            return new AccessTokenClaims(this);
        }
    }
}
