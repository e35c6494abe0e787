package com.numaansystems.mcpauth.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.mcpauth.config.OAuthSettings;
import com.numaansystems.mcpauth.crypto.AccessTokenCodec;
import com.numaansystems.mcpauth.crypto.InvalidAccessTokenException;
import com.numaansystems.mcpauth.model.AccessTokenClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bearer-token middleware in front of the MCP route.
 *
 * <p>Decrypts the {@code Authorization: Bearer} token and checks issuer, audience and
 * expiry, then checks the embedded upstream token has not expired either. On success
 * the request carries an {@link AuthInfo}; on any failure the request stops here with
 * {@code 401}, a {@code WWW-Authenticate} header pointing at the protected-resource
 * metadata, and {@code {error: "unauthorized", error_description}}.</p>
 *
 * <p>Streaming clients ({@code GET} with {@code Accept: text/event-stream}) get the same
 * error as a server-sent {@code error} event.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String EVENT_STREAM = "text/event-stream";

    static final String AUTHORIZATION_REQUIRED = "Authorization required. Use OAuth 2.1 flow.";
    static final String INVALID_TOKEN = "Invalid or expired access token";

    private final AccessTokenCodec codec;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final String wwwAuthenticate;

    public BearerTokenAuthenticationFilter(AccessTokenCodec codec, OAuthSettings settings, Clock clock,
                                           ObjectMapper objectMapper) {
        this.codec = codec;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.wwwAuthenticate = "Bearer realm=\"MCP\", resource_metadata=\""
                + settings.getProtectedResourceMetadataUrl() + "\"";
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            reject(request, response, AUTHORIZATION_REQUIRED);
            return;
        }

        AccessTokenClaims claims;
        try {
            claims = codec.decrypt(header.substring(BEARER_PREFIX.length()).trim());
        } catch (InvalidAccessTokenException e) {
            logger.debug("Rejected bearer token: {}", e.getMessage());
            reject(request, response, e.getMessage());
            return;
        }

        if (claims.getUpstreamExpiresAt() != null && !claims.getUpstreamExpiresAt().isAfter(clock.instant())) {
            logger.debug("Rejected bearer token for {}: upstream token expired", claims.getSubject());
            reject(request, response, INVALID_TOKEN);
            return;
        }

        AuthInfo authInfo = AuthInfo.from(claims);
        request.setAttribute(AuthInfo.REQUEST_ATTRIBUTE, authInfo);
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(new McpAuthenticationToken(authInfo));
        SecurityContextHolder.setContext(context);

        chain.doFilter(request, response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String description)
            throws IOException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", "unauthorized");
        body.put("error_description", description);
        String json = objectMapper.writeValueAsString(body);

        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, wwwAuthenticate);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        if (isEventStream(request)) {
            response.setContentType(EVENT_STREAM);
            response.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache");
            response.getWriter().write("event: error\ndata: " + json + "\n\n");
        } else {
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write(json);
        }
        response.flushBuffer();
    }

    private static boolean isEventStream(HttpServletRequest request) {
        String accept = request.getHeader(HttpHeaders.ACCEPT);
        return "GET".equals(request.getMethod()) && accept != null && accept.contains(EVENT_STREAM);
    }
}
