package com.numaansystems.mcpauth.upstream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.numaansystems.mcpauth.model.UpstreamTokens;

import java.time.Instant;

/**
 * Body of the upstream {@code /oauth2/v1/token} response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpstreamTokenResponse {

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("refresh_token")
    private String refreshToken;

    @JsonProperty("expires_in")
    private long expiresIn;

    @JsonProperty("origin_host")
    private String originHost;

    public UpstreamTokenResponse() {
    }

    public UpstreamTokenResponse(String accessToken, String refreshToken, long expiresIn, String originHost) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresIn = expiresIn;
        this.originHost = originHost;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public long getExpiresIn() {
        return expiresIn;
    }

    /** Host that actually served the login, when the upstream reports one. */
    public String getOriginHost() {
        return originHost;
    }

    public UpstreamTokens toTokens(Instant now) {
        return new UpstreamTokens(accessToken, refreshToken, now.plusSeconds(expiresIn));
    }
}
