package com.numaansystems.mcpauth.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.mcpauth.model.UpstreamSession;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the Tableau OAuth token endpoint and the REST session lookup.
 *
 * <p>All calls go through the shared, timeout-bounded {@link CloseableHttpClient}. Failures
 * surface as {@link UpstreamException}; token values are never logged.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class TableauOAuthClient {

    private static final Logger logger = LoggerFactory.getLogger(TableauOAuthClient.class);

    public static final String AUTHORIZE_PATH = "/oauth2/v1/auth";
    static final String TOKEN_PATH = "/oauth2/v1/token";
    static final String SESSION_PATH = "/api/3.24/sessions/current";

    private static final String USER_AGENT = "tableau-mcp-oauth";

    /** Longest upstream token lifetime accepted; anything larger is treated as a malformed response. */
    static final long MAX_EXPIRES_IN_SECONDS = Duration.ofDays(365).toSeconds();

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public TableauOAuthClient(CloseableHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Redeems an upstream authorization code.
     *
     * @param server base URL of the Tableau deployment
     * @param codeVerifier PKCE verifier for the challenge sent on the authorize redirect
     */
    public UpstreamTokenResponse exchangeAuthorizationCode(String server, String code, String redirectUri,
                                                           String clientId, String codeVerifier)
            throws UpstreamException {
        List<NameValuePair> form = new ArrayList<>();
        form.add(new BasicNameValuePair("grant_type", "authorization_code"));
        form.add(new BasicNameValuePair("code", code));
        form.add(new BasicNameValuePair("redirect_uri", redirectUri));
        form.add(new BasicNameValuePair("client_id", clientId));
        form.add(new BasicNameValuePair("code_verifier", codeVerifier));
        return requestTokens(server, form, "exchange authorization code");
    }

    public UpstreamTokenResponse refresh(String server, String refreshToken, String clientId)
            throws UpstreamException {
        List<NameValuePair> form = new ArrayList<>();
        form.add(new BasicNameValuePair("grant_type", "refresh_token"));
        form.add(new BasicNameValuePair("refresh_token", refreshToken));
        form.add(new BasicNameValuePair("client_id", clientId));
        form.add(new BasicNameValuePair("site_namespace", ""));
        return requestTokens(server, form, "exchange refresh token");
    }

    /**
     * Resolves the user and site behind an upstream access token.
     */
    public UpstreamSession getCurrentSession(String server, String accessToken) throws UpstreamException {
        HttpGet get = new HttpGet(server + SESSION_PATH);
        get.setHeader("X-Tableau-Auth", accessToken);
        get.setHeader(HttpHeaders.ACCEPT, "application/json");

        JsonNode body = execute(get, "get the current session");
        JsonNode session = body.path("session");
        String userId = session.path("user").path("id").asText(null);
        String userName = session.path("user").path("name").asText(null);
        String siteId = session.path("site").path("id").asText(null);
        String siteContentUrl = session.path("site").path("contentUrl").asText("");
        if (userId == null || userName == null || siteId == null) {
            throw new UpstreamException("Session response is missing user or site");
        }
        logger.debug("Resolved upstream session for user {} on site {}", userName, siteId);
        return new UpstreamSession(userId, userName, siteId, siteContentUrl);
    }

    private UpstreamTokenResponse requestTokens(String server, List<NameValuePair> form, String action)
            throws UpstreamException {
        HttpPost post = new HttpPost(server + TOKEN_PATH);
        post.setEntity(new UrlEncodedFormEntity(form, StandardCharsets.UTF_8));
        post.setHeader(HttpHeaders.ACCEPT, "application/json");

        JsonNode body = execute(post, action);
        if (!body.isObject()) {
            throw new UpstreamException("Failed to " + action + ": unexpected token response");
        }
        UpstreamTokenResponse tokens;
        try {
            tokens = objectMapper.convertValue(body, UpstreamTokenResponse.class);
        } catch (IllegalArgumentException e) {
            throw new UpstreamException("Failed to " + action + ": malformed token response", e);
        }
        if (isBlank(tokens.getAccessToken()) || isBlank(tokens.getRefreshToken()) || tokens.getExpiresIn() < 0) {
            throw new UpstreamException("Failed to " + action + ": incomplete token response");
        }
        if (tokens.getExpiresIn() > MAX_EXPIRES_IN_SECONDS) {
            throw new UpstreamException("Failed to " + action + ": expires_in out of range");
        }
        return tokens;
    }

    private JsonNode execute(HttpUriRequestBase request, String action) throws UpstreamException {
        request.setHeader(HttpHeaders.USER_AGENT, USER_AGENT);
        logger.debug("Upstream {} {}", request.getMethod(), request.getRequestUri());

        RawResponse response;
        try {
            response = httpClient.execute(request, httpResponse -> new RawResponse(
                    httpResponse.getCode(),
                    httpResponse.getEntity() == null
                            ? ""
                            : EntityUtils.toString(httpResponse.getEntity(), StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new UpstreamException("Failed to " + action + ": " + e.getMessage(), e);
        }

        if (response.status < 200 || response.status >= 300) {
            logger.warn("Upstream call to {} failed with status {}", request.getRequestUri(), response.status);
            throw new UpstreamException("Failed to " + action + ": " + response.status, response.status, null);
        }
        try {
            return objectMapper.readTree(response.body);
        } catch (IOException e) {
            throw new UpstreamException("Failed to " + action + ": response is not JSON", response.status, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class RawResponse {
        private final int status;
        private final String body;

        private RawResponse(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }
}
