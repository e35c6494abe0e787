package com.numaansystems.mcpauth.store;

import com.numaansystems.mcpauth.model.PendingAuthorization;
import com.numaansystems.mcpauth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PendingAuthorizationStore.
 */
class PendingAuthorizationStoreTest {

    private MutableClock clock;
    private PendingAuthorizationStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        store = new PendingAuthorizationStore(Duration.ofMinutes(10), clock);
    }

    private PendingAuthorization pending() {
        return new PendingAuthorization("client-1", "https://app.example.com/cb", "challenge", "S256",
                "client-state", List.of("read"), "upstream-1", clock.instant());
    }

    @Test
    @DisplayName("Should hand a pending authorization to the first callback only")
    void testSingleUse() {
        store.save("corr-1", pending());

        assertEquals("client-state", store.consume("corr-1").orElseThrow().getState());
        assertTrue(store.consume("corr-1").isEmpty());
    }

    @Test
    @DisplayName("Should keep a pending authorization until just before its TTL")
    void testTtl() {
        store.save("corr-1", pending());
        store.save("corr-2", pending());

        clock.advance(Duration.ofMinutes(10).minusMillis(1));
        assertTrue(store.consume("corr-1").isPresent());

        clock.advance(Duration.ofMillis(1));
        assertTrue(store.consume("corr-2").isEmpty());
    }
}
