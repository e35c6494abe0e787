package com.numaansystems.mcpauth.crypto;

import com.nimbusds.jwt.EncryptedJWT;
import com.numaansystems.mcpauth.model.AccessTokenClaims;
import com.numaansystems.mcpauth.model.UpstreamTokens;
import com.numaansystems.mcpauth.support.MutableClock;
import com.numaansystems.mcpauth.support.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AccessTokenCodec.
 *
 * <p>Tests that tokens are real compact JWEs, that every claim survives, and that issuer,
 * audience, expiry and key mismatches are rejected.</p>
 */
class AccessTokenCodecTest {

    private static final String ISSUER = "https://mcp.example.com";
    private static final String AUDIENCE = "tableau-mcp-server";

    private MutableClock clock;
    private AccessTokenCodec codec;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        codec = new AccessTokenCodec(TestKeys.rsa(), ISSUER, AUDIENCE, clock);
    }

    private AccessTokenClaims.Builder claims(String issuer, String audience) {
        Instant now = clock.instant();
        return AccessTokenClaims.builder()
                .issuer(issuer)
                .audience(audience)
                .subject("user@example.com")
                .clientId("client-1")
                .scopes(List.of("tableau:mcp:content:read", "read"))
                .issuedAt(now)
                .expiresAt(now.plus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("Should mint a compact JWE with RSA-OAEP-256 and A256GCM")
    void testTokenFormat() throws Exception {
        // Act
        String token = codec.encrypt(claims(ISSUER, AUDIENCE).build());

        // Assert
        assertEquals(5, token.split("\\.", -1).length, "Compact JWE has five parts");
        EncryptedJWT jwt = EncryptedJWT.parse(token);
        assertEquals("RSA-OAEP-256", jwt.getHeader().getAlgorithm().getName());
        assertEquals("A256GCM", jwt.getHeader().getEncryptionMethod().getName());
        assertFalse(token.contains("user@example.com"));
    }

    @Test
    @DisplayName("Should decrypt every claim that was encrypted")
    void testRoundTrip() throws Exception {
        // Arrange
        Instant upstreamExpiry = clock.instant().plus(Duration.ofHours(2));
        String token = codec.encrypt(claims(ISSUER, AUDIENCE)
                .siteId("site-1")
                .targetUrl("https://online.tableau.com")
                .upstreamUserId("user-1")
                .upstreamTokens(new UpstreamTokens("upstream-access", "upstream-refresh", upstreamExpiry))
                .build());

        // Act
        AccessTokenClaims decoded = codec.decrypt(token);

        // Assert
        assertEquals("user@example.com", decoded.getSubject());
        assertEquals("client-1", decoded.getClientId());
        assertEquals(List.of("tableau:mcp:content:read", "read"), decoded.getScopes());
        assertEquals("site-1", decoded.getSiteId());
        assertEquals("https://online.tableau.com", decoded.getTargetUrl());
        assertEquals("user-1", decoded.getUpstreamUserId());
        assertEquals("upstream-access", decoded.getUpstreamAccessToken());
        assertEquals("upstream-refresh", decoded.getUpstreamRefreshToken());
        assertEquals(upstreamExpiry.getEpochSecond(), decoded.getUpstreamExpiresAt().getEpochSecond());
    }

    @Test
    @DisplayName("Should reject a token at or after its expiry")
    void testExpired() {
        String token = codec.encrypt(claims(ISSUER, AUDIENCE).build());
        clock.advance(Duration.ofHours(1));

        assertThrows(InvalidAccessTokenException.class, () -> codec.decrypt(token));
    }

    @Test
    @DisplayName("Should reject a token minted for another audience")
    void testWrongAudience() {
        String token = codec.encrypt(claims(ISSUER, "some-other-resource").build());

        assertThrows(InvalidAccessTokenException.class, () -> codec.decrypt(token));
    }

    @Test
    @DisplayName("Should reject a token from another issuer")
    void testWrongIssuer() {
        String token = codec.encrypt(claims("https://evil.example.com", AUDIENCE).build());

        assertThrows(InvalidAccessTokenException.class, () -> codec.decrypt(token));
    }

    @Test
    @DisplayName("Should reject a token encrypted for a different key")
    void testWrongKey() {
        AccessTokenCodec other = new AccessTokenCodec(TestKeys.generate("RSA", 2048), ISSUER, AUDIENCE, clock);
        String token = other.encrypt(claims(ISSUER, AUDIENCE).build());

        assertThrows(InvalidAccessTokenException.class, () -> codec.decrypt(token));
    }

    @Test
    @DisplayName("Should reject malformed and missing tokens")
    void testMalformed() {
        assertThrows(InvalidAccessTokenException.class, () -> codec.decrypt("not.a.token"));
        assertThrows(InvalidAccessTokenException.class, () -> codec.decrypt(""));
        assertThrows(InvalidAccessTokenException.class, () -> codec.decrypt(null));
    }
}
