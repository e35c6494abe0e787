package com.numaansystems.mcpauth.model;

import java.time.Instant;
import java.util.List;

/**
 * Client known to the authorization server, either registered dynamically through
 * {@code /oauth/register} or pre-provisioned from configuration.
 *
 * <p>Static clients carry no redirect URIs; their redirect targets are checked against
 * the redirect-URI policy only.</p>
 */
public final class RegisteredClient {

    private final String clientId;
    private final String clientSecret;
    private final List<String> redirectUris;
    private final Instant registeredAt;
    private final boolean preProvisioned;

    public RegisteredClient(String clientId, String clientSecret, List<String> redirectUris,
                            Instant registeredAt, boolean preProvisioned) {
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.redirectUris = redirectUris == null ? List.of() : List.copyOf(redirectUris);
        this.registeredAt = registeredAt;
        this.preProvisioned = preProvisioned;
    }

    public static RegisteredClient preProvisioned(String clientId, String clientSecret) {
        return new RegisteredClient(clientId, clientSecret, List.of(), Instant.EPOCH, true);
    }

    public String getClientId() {
        return clientId;
    }

    /** Null for public clients. */
    public String getClientSecret() {
        return clientSecret;
    }

    public List<String> getRedirectUris() {
        return redirectUris;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public boolean isPreProvisioned() {
        return preProvisioned;
    }

    public boolean isConfidential() {
        return clientSecret != null;
    }

    @Override
    public String toString() {
        return "RegisteredClient{clientId='" + clientId + "', confidential=" + isConfidential()
                + ", preProvisioned=" + preProvisioned + ", redirectUris=" + redirectUris + "}";
    }
}
