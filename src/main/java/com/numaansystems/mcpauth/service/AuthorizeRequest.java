package com.numaansystems.mcpauth.service;

/**
 * Query parameters of {@code GET /oauth/authorize}.
 */
public final class AuthorizeRequest {

    private final String clientId;
    private final String redirectUri;
    private final String responseType;
    private final String codeChallenge;
    private final String codeChallengeMethod;
    private final String state;
    private final String scope;

    public AuthorizeRequest(String clientId, String redirectUri, String responseType, String codeChallenge,
                            String codeChallengeMethod, String state, String scope) {
        this.clientId = clientId;
        this.redirectUri = redirectUri;
        this.responseType = responseType;
        this.codeChallenge = codeChallenge;
        this.codeChallengeMethod = codeChallengeMethod;
        this.state = state;
        this.scope = scope;
    }

    public String getClientId() {
        return clientId;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public String getResponseType() {
        return responseType;
    }

    public String getCodeChallenge() {
        return codeChallenge;
    }

    public String getCodeChallengeMethod() {
        return codeChallengeMethod;
    }

    public String getState() {
        return state;
    }

    public String getScope() {
        return scope;
    }
}
