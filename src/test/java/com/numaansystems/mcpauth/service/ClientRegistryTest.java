package com.numaansystems.mcpauth.service;

import com.numaansystems.mcpauth.model.RegisteredClient;
import com.numaansystems.mcpauth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ClientRegistry.
 *
 * <p>Tests registration, lookup across both client sources, and authentication outcomes
 * for known, unknown and public clients.</p>
 */
class ClientRegistryTest {

    private static final List<String> REDIRECTS = List.of("https://app.example.com/cb");

    private MutableClock clock;
    private ClientRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        registry = new ClientRegistry(Map.of("svc", "s3cret"), Duration.ofMinutes(10), clock);
    }

    @Test
    @DisplayName("Should register a confidential client with a fresh id and secret")
    void testRegisterConfidential() {
        // Act
        RegisteredClient first = registry.register(REDIRECTS, true);
        RegisteredClient second = registry.register(REDIRECTS, true);

        // Assert
        assertTrue(first.isConfidential());
        assertEquals(64, first.getClientSecret().length());
        assertNotEquals(first.getClientId(), second.getClientId());
        assertEquals(REDIRECTS, registry.find(first.getClientId()).orElseThrow().getRedirectUris());
        assertEquals(3, registry.size());
    }

    @Test
    @DisplayName("Should register a public client without a secret")
    void testRegisterPublic() {
        RegisteredClient client = registry.register(REDIRECTS, false);

        assertFalse(client.isConfidential());
        assertNull(client.getClientSecret());
    }

    @Test
    @DisplayName("Should find pre-provisioned clients")
    void testFindStatic() {
        RegisteredClient client = registry.find("svc").orElseThrow();

        assertTrue(client.isPreProvisioned());
        assertTrue(client.getRedirectUris().isEmpty());
        assertTrue(registry.find("unknown").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    @DisplayName("Should forget dynamic clients after the registration TTL")
    void testRegistrationExpiry() {
        RegisteredClient client = registry.register(REDIRECTS, true);

        clock.advance(Duration.ofMinutes(10));

        assertTrue(registry.find(client.getClientId()).isEmpty());
        assertTrue(registry.find("svc").isPresent(), "Static clients never expire");
    }

    @Test
    @DisplayName("Should keep a retained client past the registration TTL")
    void testRetain() {
        RegisteredClient client = registry.register(REDIRECTS, true);

        registry.retain(client.getClientId(), Duration.ofDays(30));
        clock.advance(Duration.ofDays(1));

        assertTrue(registry.find(client.getClientId()).isPresent());
    }

    @Test
    @DisplayName("Should authenticate a static client with its secret")
    void testAuthenticateStatic() {
        RegisteredClient client = registry.authenticate(new ClientCredentials("svc", "s3cret"));

        assertEquals("svc", client.getClientId());
    }

    @Test
    @DisplayName("Should reject wrong secrets of any length with the same error")
    void testWrongSecret() {
        // Act
        OAuthException sameLength = assertThrows(OAuthException.class,
                () -> registry.authenticate(new ClientCredentials("svc", "s3creX")));
        OAuthException longer = assertThrows(OAuthException.class,
                () -> registry.authenticate(new ClientCredentials("svc", "a-much-longer-wrong-secret")));
        OAuthException missing = assertThrows(OAuthException.class,
                () -> registry.authenticate(new ClientCredentials("svc", null)));

        // Assert
        for (OAuthException e : List.of(sameLength, longer, missing)) {
            assertEquals("invalid_client", e.getError());
            assertEquals(ClientRegistry.INVALID_CREDENTIALS, e.getDescription());
            assertEquals(401, e.getStatus().value());
        }
    }

    @Test
    @DisplayName("Should reject an unknown client like a wrong secret")
    void testUnknownClient() {
        OAuthException e = assertThrows(OAuthException.class,
                () -> registry.authenticate(new ClientCredentials("nobody", "whatever")));

        assertEquals("invalid_client", e.getError());
        assertEquals(ClientRegistry.INVALID_CREDENTIALS, e.getDescription());
    }

    @Test
    @DisplayName("Should authenticate a public client by id alone")
    void testAuthenticatePublic() {
        RegisteredClient client = registry.register(REDIRECTS, false);

        assertSame(client, registry.authenticate(new ClientCredentials(client.getClientId(), null)));
    }
}
