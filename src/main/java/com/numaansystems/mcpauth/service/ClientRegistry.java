package com.numaansystems.mcpauth.service;

import com.numaansystems.mcpauth.config.OAuthSettings;
import com.numaansystems.mcpauth.crypto.RandomTokens;
import com.numaansystems.mcpauth.crypto.SecretComparator;
import com.numaansystems.mcpauth.model.RegisteredClient;
import com.numaansystems.mcpauth.util.ExpiringMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Clients allowed to use the authorization server.
 *
 * <p>Two sources, checked in order:</p>
 * <ol>
 *   <li>pre-provisioned {@code id:secret} pairs from {@code OAUTH_CLIENT_ID_SECRET_PAIRS},
 *       which live as long as the process</li>
 *   <li>clients registered through {@code /oauth/register}, held in an {@link ExpiringMap}
 *       and forgotten after the registration TTL unless tokens are issued to them</li>
 * </ol>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class ClientRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ClientRegistry.class);

    static final String INVALID_CREDENTIALS = "Invalid client credentials";

    // Compared against when the client id is unknown, so that case costs the same as a bad secret.
    private static final String UNKNOWN_CLIENT_SECRET = RandomTokens.generate();

    private final Map<String, RegisteredClient> staticClients;
    private final ExpiringMap<String, RegisteredClient> dynamicClients;
    private final Clock clock;

    @Autowired
    public ClientRegistry(OAuthSettings settings, Clock clock) {
        this(settings.getClientIdSecretPairs(), settings.getClientRegistrationTtl(), clock);
    }

    public ClientRegistry(Map<String, String> clientIdSecretPairs, Duration registrationTtl, Clock clock) {
        Map<String, RegisteredClient> clients = new LinkedHashMap<>();
        clientIdSecretPairs.forEach((id, secret) -> clients.put(id, RegisteredClient.preProvisioned(id, secret)));
        this.staticClients = Collections.unmodifiableMap(clients);
        this.dynamicClients = new ExpiringMap<>(registrationTtl, clock);
        this.clock = clock;
        logger.info("Client registry initialized with {} pre-provisioned client(s), registration TTL {}",
                staticClients.size(), registrationTtl);
    }

    /**
     * Registers a new client with a fresh id, and a secret when it is confidential.
     *
     * @param redirectUris already validated redirect URIs
     */
    public RegisteredClient register(List<String> redirectUris, boolean confidential) {
        String clientId = RandomTokens.generate(16);
        String clientSecret = confidential ? RandomTokens.generate() : null;
        RegisteredClient client = new RegisteredClient(clientId, clientSecret, redirectUris, clock.instant(), false);
        dynamicClients.put(clientId, client);
        logger.info("Registered client {} ({}) with {} redirect URI(s)",
                clientId, confidential ? "confidential" : "public", redirectUris.size());
        return client;
    }

    public Optional<RegisteredClient> find(String clientId) {
        if (clientId == null || clientId.isEmpty()) {
            return Optional.empty();
        }
        RegisteredClient preProvisioned = staticClients.get(clientId);
        if (preProvisioned != null) {
            return Optional.of(preProvisioned);
        }
        return dynamicClients.get(clientId);
    }

    /**
     * Authenticates a client at the token endpoint.
     *
     * <p>Confidential clients must present their secret; public clients are identified by
     * id alone. The secret comparison does not depend on the secret's length.</p>
     *
     * @return the authenticated client
     * @throws OAuthException {@code invalid_client} when the id is unknown or the secret is wrong
     */
    public RegisteredClient authenticate(ClientCredentials credentials) {
        Optional<RegisteredClient> client = find(credentials.getClientId());
        if (client.isEmpty()) {
            SecretComparator.matches(credentials.getClientSecret(), UNKNOWN_CLIENT_SECRET);
            logger.warn("Client authentication failed: unknown client");
            throw OAuthException.invalidClient(INVALID_CREDENTIALS);
        }

        RegisteredClient registered = client.get();
        if (registered.isConfidential()
                && !SecretComparator.matches(credentials.getClientSecret(), registered.getClientSecret())) {
            logger.warn("Client authentication failed for client {}", registered.getClientId());
            throw OAuthException.invalidClient(INVALID_CREDENTIALS);
        }
        return registered;
    }

    /**
     * Keeps a dynamically registered client for at least {@code ttl} from now, so clients
     * holding a refresh token can still authenticate when they use it.
     */
    public void retain(String clientId, Duration ttl) {
        if (staticClients.containsKey(clientId)) {
            return;
        }
        dynamicClients.get(clientId).ifPresent(client -> dynamicClients.put(clientId, client, ttl));
    }

    public int purgeExpired() {
        return dynamicClients.purgeExpired();
    }

    public int size() {
        return staticClients.size() + dynamicClients.size();
    }
}
