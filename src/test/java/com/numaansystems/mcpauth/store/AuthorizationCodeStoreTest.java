package com.numaansystems.mcpauth.store;

import com.numaansystems.mcpauth.model.AuthorizationCode;
import com.numaansystems.mcpauth.model.UpstreamSession;
import com.numaansystems.mcpauth.model.UpstreamTokens;
import com.numaansystems.mcpauth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AuthorizationCodeStore.
 */
class AuthorizationCodeStoreTest {

    private MutableClock clock;
    private AuthorizationCodeStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        store = new AuthorizationCodeStore(Duration.ofMinutes(2), clock);
    }

    private AuthorizationCode code() {
        return new AuthorizationCode("client-1", "https://app.example.com/cb", "challenge", List.of("read"),
                "https://online.tableau.com", new UpstreamSession("u1", "user@example.com", "s1", "site"),
                new UpstreamTokens("a", "r", clock.instant().plusSeconds(3600)), "upstream-1", clock.instant());
    }

    @Test
    @DisplayName("Should redeem a code exactly once")
    void testSingleUse() {
        // Arrange
        store.save("code-1", code());

        // Act
        Optional<AuthorizationCode> first = store.consume("code-1");
        Optional<AuthorizationCode> second = store.consume("code-1");

        // Assert
        assertTrue(first.isPresent());
        assertEquals("client-1", first.get().getClientId());
        assertTrue(second.isEmpty());
    }

    @Test
    @DisplayName("Should not redeem a code after its TTL")
    void testExpiry() {
        store.save("code-1", code());
        clock.advance(Duration.ofMinutes(2));

        assertTrue(store.consume("code-1").isEmpty());
    }

    @Test
    @DisplayName("Should purge expired codes")
    void testPurge() {
        store.save("code-1", code());
        clock.advance(Duration.ofMinutes(1));
        store.save("code-2", code());
        clock.advance(Duration.ofMinutes(1).plusSeconds(1));

        assertEquals(1, store.purgeExpired());
        assertEquals(1, store.size());
    }
}
