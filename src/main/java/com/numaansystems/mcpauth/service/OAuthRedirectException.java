package com.numaansystems.mcpauth.service;

import com.numaansystems.mcpauth.util.UriQueries;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OAuth error reported by redirecting back to the client's own {@code redirect_uri}.
 *
 * <p>Only thrown once the redirect URI has been validated for the client, so an error
 * redirect can never be used to bounce the user agent to an arbitrary location.</p>
 */
public class OAuthRedirectException extends RuntimeException {

    private final String redirectUri;
    private final String error;
    private final String state;

    public OAuthRedirectException(String redirectUri, String error, String description, String state) {
        super(description);
        this.redirectUri = redirectUri;
        this.error = error;
        this.state = state;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public String getError() {
        return error;
    }

    public String getDescription() {
        return getMessage();
    }

    public String getState() {
        return state;
    }

    /**
     * The client redirect URI with {@code error}, {@code error_description} and, when the
     * client sent one, {@code state} appended.
     */
    public URI toLocation() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("error", error);
        params.put("error_description", getMessage());
        if (state != null && !state.isEmpty()) {
            params.put("state", state);
        }
        return UriQueries.append(redirectUri, params);
    }
}
