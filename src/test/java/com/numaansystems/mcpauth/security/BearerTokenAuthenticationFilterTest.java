package com.numaansystems.mcpauth.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.mcpauth.config.OAuthProvider;
import com.numaansystems.mcpauth.config.OAuthSettings;
import com.numaansystems.mcpauth.crypto.AccessTokenCodec;
import com.numaansystems.mcpauth.model.AccessTokenClaims;
import com.numaansystems.mcpauth.model.UpstreamTokens;
import com.numaansystems.mcpauth.support.MutableClock;
import com.numaansystems.mcpauth.support.TestKeys;
import com.numaansystems.mcpauth.support.TestSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BearerTokenAuthenticationFilter.
 */
class BearerTokenAuthenticationFilterTest {

    private static final String METADATA_HEADER =
            "Bearer realm=\"MCP\", resource_metadata=\"https://mcp.example.com/.well-known/oauth-protected-resource\"";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MutableClock clock;
    private AccessTokenCodec codec;
    private BearerTokenAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        OAuthSettings settings = TestSettings.create("");
        codec = new AccessTokenCodec(TestKeys.rsa(), TestSettings.ISSUER, OAuthProvider.AUDIENCE, clock);
        filter = new BearerTokenAuthenticationFilter(codec, settings, clock, objectMapper);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private String token(Instant upstreamExpiry) {
        Instant now = clock.instant();
        return codec.encrypt(AccessTokenClaims.builder()
                .issuer(TestSettings.ISSUER)
                .audience(OAuthProvider.AUDIENCE)
                .subject("user@example.com")
                .clientId("client-1")
                .scopes(List.of("read"))
                .issuedAt(now)
                .expiresAt(now.plus(Duration.ofHours(1)))
                .siteId("site-1")
                .targetUrl(TestSettings.TABLEAU_SERVER)
                .upstreamUserId("user-1")
                .upstreamTokens(new UpstreamTokens("up-access", "up-refresh", upstreamExpiry))
                .build());
    }

    private MockHttpServletRequest request(String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/tableau-mcp");
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return request;
    }

    @Test
    @DisplayName("Should expose AuthInfo and continue the chain for a valid token")
    void testValidToken() throws Exception {
        // Arrange
        MockHttpServletRequest request = request("Bearer " + token(clock.instant().plus(Duration.ofHours(2))));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // Act
        filter.doFilter(request, response, chain);

        // Assert
        assertNotNull(chain.getRequest(), "Chain should continue");
        AuthInfo authInfo = AuthInfo.current(request).orElseThrow();
        assertEquals("user@example.com", authInfo.getSubject());
        assertEquals("client-1", authInfo.getClientId());
        assertEquals("site-1", authInfo.getSiteId());
        assertEquals("up-access", authInfo.getUpstreamAccessToken());
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertTrue(authentication.isAuthenticated());
        assertSame(authInfo, authentication.getPrincipal());
        assertEquals("SCOPE_read", authentication.getAuthorities().iterator().next().getAuthority());
    }

    @Test
    @DisplayName("Should reject a request without a bearer token")
    void testMissingToken() throws Exception {
        // Arrange
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // Act
        filter.doFilter(request(null), response, chain);

        // Assert
        assertNull(chain.getRequest(), "Chain should stop");
        assertEquals(401, response.getStatus());
        assertEquals(METADATA_HEADER, response.getHeader("WWW-Authenticate"));
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("unauthorized", body.get("error").asText());
        assertEquals(BearerTokenAuthenticationFilter.AUTHORIZATION_REQUIRED, body.get("error_description").asText());
    }

    @Test
    @DisplayName("Should reject Basic credentials on the MCP route")
    void testBasicScheme() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request("Basic c3ZjOnMzY3JldA=="), response, new MockFilterChain());

        assertEquals(401, response.getStatus());
    }

    @Test
    @DisplayName("Should reject a token that does not decrypt")
    void testGarbageToken() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request("Bearer not-a-jwe"), response, new MockFilterChain());

        assertEquals(401, response.getStatus());
        assertEquals("unauthorized", objectMapper.readTree(response.getContentAsString()).get("error").asText());
    }

    @Test
    @DisplayName("Should reject an expired access token")
    void testExpiredToken() throws Exception {
        String token = token(clock.instant().plus(Duration.ofHours(2)));
        clock.advance(Duration.ofHours(1));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request("Bearer " + token), response, new MockFilterChain());

        assertEquals(401, response.getStatus());
    }

    @Test
    @DisplayName("Should reject a token whose upstream token has expired")
    void testUpstreamExpired() throws Exception {
        String token = token(clock.instant().plus(Duration.ofMinutes(5)));
        clock.advance(Duration.ofMinutes(5));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("Bearer " + token), response, chain);

        assertEquals(401, response.getStatus());
        assertNull(chain.getRequest());
        assertEquals(BearerTokenAuthenticationFilter.INVALID_TOKEN,
                objectMapper.readTree(response.getContentAsString()).get("error_description").asText());
    }

    @Test
    @DisplayName("Should answer streaming clients with a server-sent error event")
    void testEventStreamError() throws Exception {
        // Arrange
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/tableau-mcp");
        request.addHeader("Accept", "text/event-stream");
        MockHttpServletResponse response = new MockHttpServletResponse();

        // Act
        filter.doFilter(request, response, new MockFilterChain());

        // Assert
        assertEquals(401, response.getStatus());
        assertTrue(response.getContentType().startsWith("text/event-stream"));
        assertEquals("no-cache", response.getHeader("Cache-Control"));
        String body = response.getContentAsString();
        assertTrue(body.startsWith("event: error\ndata: {"));
        assertTrue(body.endsWith("}\n\n"));
        assertTrue(body.contains("\"error\":\"unauthorized\""));
    }
}
