package com.numaansystems.mcpauth.service;

/**
 * Client id and secret presented at the token endpoint, from Basic auth or the form body.
 */
public final class ClientCredentials {

    private final String clientId;
    private final String clientSecret;

    public ClientCredentials(String clientId, String clientSecret) {
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public boolean hasClientId() {
        return clientId != null && !clientId.isEmpty();
    }

    @Override
    public String toString() {
        return "ClientCredentials{clientId='" + clientId + "'}";
    }
}
