package com.numaansystems.mcpauth.model;

/**
 * User and site resolved from the upstream REST API for a freshly issued upstream token.
 */
public final class UpstreamSession {

    private final String userId;
    private final String userName;
    private final String siteId;
    private final String siteContentUrl;

    public UpstreamSession(String userId, String userName, String siteId, String siteContentUrl) {
        this.userId = userId;
        this.userName = userName;
        this.siteId = siteId;
        this.siteContentUrl = siteContentUrl;
    }

    public String getUserId() {
        return userId;
    }

    public String getUserName() {
        return userName;
    }

    public String getSiteId() {
        return siteId;
    }

    public String getSiteContentUrl() {
        return siteContentUrl;
    }
}
