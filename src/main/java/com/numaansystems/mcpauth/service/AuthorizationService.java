package com.numaansystems.mcpauth.service;

import com.numaansystems.mcpauth.config.OAuthProvider;
import com.numaansystems.mcpauth.config.OAuthSettings;
import com.numaansystems.mcpauth.crypto.Pkce;
import com.numaansystems.mcpauth.crypto.RandomTokens;
import com.numaansystems.mcpauth.dns.DnsResolutionException;
import com.numaansystems.mcpauth.dns.PublicHostVerifier;
import com.numaansystems.mcpauth.model.AuthorizationCode;
import com.numaansystems.mcpauth.model.PendingAuthorization;
import com.numaansystems.mcpauth.model.RegisteredClient;
import com.numaansystems.mcpauth.model.Scopes;
import com.numaansystems.mcpauth.model.UpstreamSession;
import com.numaansystems.mcpauth.upstream.TableauOAuthClient;
import com.numaansystems.mcpauth.upstream.UpstreamException;
import com.numaansystems.mcpauth.upstream.UpstreamTokenResponse;
import com.numaansystems.mcpauth.util.UriQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Front half of the login flow: {@code /oauth/authorize} and the upstream callback.
 *
 * <h2>Authorize</h2>
 * <ol>
 *   <li>resolve the client and validate its redirect URI; failures here are answered
 *       with JSON because the redirect target is not trusted yet</li>
 *   <li>validate response type, PKCE challenge and scopes; failures from here on are
 *       redirected back to the client</li>
 *   <li>verify the upstream host resolves to public addresses through pinned DNS</li>
 *   <li>store a {@link PendingAuthorization} under a fresh correlation token and redirect
 *       to Tableau with that token as {@code state}</li>
 * </ol>
 *
 * <h2>Callback</h2>
 * <ol>
 *   <li>consume the pending authorization; a second delivery finds nothing</li>
 *   <li>exchange the upstream code, check {@code origin_host}, resolve the session</li>
 *   <li>store a single-use {@link AuthorizationCode} and redirect to the client with
 *       {@code code} and its original {@code state}</li>
 * </ol>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class AuthorizationService {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationService.class);

    static final String RESPONSE_TYPE_CODE = "code";
    static final String CLIENT_TYPE = "tableau-mcp";
    static final String VSCODE_REDIRECT_URI = "https://vscode.dev/redirect";

    private final OAuthProvider provider;
    private final ClientRegistry clientRegistry;
    private final OAuthSettings settings;
    private final PublicHostVerifier hostVerifier;
    private final TableauOAuthClient tableauClient;
    private final Clock clock;

    public AuthorizationService(OAuthProvider provider, ClientRegistry clientRegistry, OAuthSettings settings,
                                PublicHostVerifier hostVerifier, TableauOAuthClient tableauClient, Clock clock) {
        this.provider = provider;
        this.clientRegistry = clientRegistry;
        this.settings = settings;
        this.hostVerifier = hostVerifier;
        this.tableauClient = tableauClient;
        this.clock = clock;
    }

    /**
     * Validates an authorize request and records it.
     *
     * @return the upstream authorization URL to redirect the user agent to
     * @throws OAuthException if the client or redirect URI cannot be trusted
     * @throws OAuthRedirectException for any later validation failure
     */
    public URI authorize(AuthorizeRequest request) {
        if (isBlank(request.getClientId())) {
            throw OAuthException.invalidRequest("client_id is required");
        }
        RegisteredClient client = clientRegistry.find(request.getClientId())
                .orElseThrow(() -> {
                    logger.warn("Authorize request for unknown client {}", request.getClientId());
                    return new OAuthException(OAuth2ErrorCodes.INVALID_CLIENT, "Unknown client",
                            HttpStatus.BAD_REQUEST);
                });

        String redirectUri = request.getRedirectUri();
        if (isBlank(redirectUri)) {
            throw OAuthException.invalidRequest("redirect_uri is required");
        }
        if (!RedirectUriPolicy.isAllowed(redirectUri)) {
            throw OAuthException.invalidRequest(
                    "Invalid redirect URI: must use HTTPS, localhost HTTP, or custom scheme");
        }
        // Static clients register no redirect URIs, so they never pass this check.
        if (!client.getRedirectUris().contains(redirectUri)) {
            logger.warn("Authorize request for client {} with an unregistered redirect URI", client.getClientId());
            throw OAuthException.invalidRequest("redirect_uri is not registered for this client");
        }

        String state = request.getState();
        if (!RESPONSE_TYPE_CODE.equals(request.getResponseType())) {
            throw new OAuthRedirectException(redirectUri, OAuth2ErrorCodes.UNSUPPORTED_RESPONSE_TYPE,
                    "Only authorization code flow is supported", state);
        }
        if (isBlank(request.getCodeChallenge())) {
            throw new OAuthRedirectException(redirectUri, OAuth2ErrorCodes.INVALID_REQUEST,
                    "code_challenge is required", state);
        }
        if (!Pkce.METHOD_S256.equals(request.getCodeChallengeMethod())) {
            throw new OAuthRedirectException(redirectUri, OAuth2ErrorCodes.INVALID_REQUEST,
                    "Only S256 code challenge method is supported", state);
        }
        List<String> scopes = resolveScopes(request.getScope(), redirectUri, state);

        String upstreamHost = URI.create(settings.getTableauServer()).getHost();
        try {
            hostVerifier.verify(upstreamHost);
        } catch (DnsResolutionException e) {
            logger.error("Upstream host {} failed DNS verification: {}", upstreamHost, e.getMessage());
            throw new OAuthRedirectException(redirectUri, OAuth2ErrorCodes.SERVER_ERROR,
                    "Unable to reach the identity provider", state);
        }

        String correlationToken = RandomTokens.generate();
        String upstreamClientId = UUID.randomUUID().toString();
        provider.getPendingAuthorizations().save(correlationToken, new PendingAuthorization(
                client.getClientId(), redirectUri, request.getCodeChallenge(), request.getCodeChallengeMethod(),
                state == null ? "" : state, scopes, upstreamClientId, clock.instant()));

        logger.info("Authorization started for client {}, redirecting to {}", client.getClientId(), upstreamHost);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", upstreamClientId);
        params.put("code_challenge", Pkce.challengeFor(request.getCodeChallenge()));
        params.put("code_challenge_method", Pkce.METHOD_S256);
        params.put("response_type", RESPONSE_TYPE_CODE);
        params.put("redirect_uri", settings.getRedirectUri());
        params.put("state", correlationToken);
        params.put("device_id", UUID.randomUUID().toString());
        params.put("target_site", settings.getSiteName() == null ? "" : settings.getSiteName());
        params.put("device_name", deviceName(redirectUri, state));
        params.put("client_type", CLIENT_TYPE);
        return UriQueries.append(settings.getTableauServer() + TableauOAuthClient.AUTHORIZE_PATH, params);
    }

    /**
     * Completes the upstream login.
     *
     * @return the client redirect URI carrying {@code code} and the client's {@code state}
     * @throws OAuthException if the correlation token is missing, unknown, expired or already used
     * @throws OAuthRedirectException if the upstream login failed
     */
    public URI handleCallback(String code, String state, String error, String errorDescription) {
        if (isBlank(state)) {
            throw OAuthException.invalidRequest("state is required");
        }
        PendingAuthorization pending = provider.getPendingAuthorizations().consume(state)
                .orElseThrow(() -> {
                    logger.warn("Callback with unknown, expired or already used state");
                    return OAuthException.invalidRequest("Invalid state parameter");
                });

        String redirectUri = pending.getRedirectUri();
        String clientState = pending.getState();
        if (isBlank(pending.getCodeChallenge()) || isBlank(pending.getUpstreamClientId())) {
            logger.error("Pending authorization for client {} is missing PKCE data", pending.getClientId());
            throw new OAuthRedirectException(redirectUri, OAuth2ErrorCodes.SERVER_ERROR,
                    "Internal server error during authorization", clientState);
        }
        if (!isBlank(error)) {
            logger.warn("Upstream denied authorization for client {}: {}", pending.getClientId(), error);
            String description = "Upstream authorization failed: " + error
                    + (isBlank(errorDescription) ? "" : " (" + errorDescription + ")");
            throw new OAuthRedirectException(redirectUri, OAuth2ErrorCodes.ACCESS_DENIED, description, clientState);
        }
        if (isBlank(code)) {
            throw new OAuthRedirectException(redirectUri, OAuth2ErrorCodes.INVALID_REQUEST,
                    "Missing upstream authorization code", clientState);
        }

        UpstreamTokenResponse tokens;
        try {
            tokens = tableauClient.exchangeAuthorizationCode(settings.getTableauServer(), code,
                    settings.getRedirectUri(), pending.getUpstreamClientId(), pending.getCodeChallenge());
        } catch (UpstreamException e) {
            logger.warn("Upstream code exchange failed for client {}: {}", pending.getClientId(), e.getMessage());
            throw upstreamFailure(e, redirectUri, "Unable to exchange the upstream authorization code", clientState);
        }

        String targetUrl = resolveTargetUrl(tokens.getOriginHost(), redirectUri, clientState);

        UpstreamSession session;
        try {
            session = tableauClient.getCurrentSession(targetUrl, tokens.getAccessToken());
        } catch (UpstreamException e) {
            logger.warn("Unable to resolve upstream session for client {}: {}", pending.getClientId(), e.getMessage());
            throw upstreamFailure(e, redirectUri, "Unable to get the Tableau server session", clientState);
        }

        Instant now = clock.instant();
        String authorizationCode = RandomTokens.generate();
        provider.getAuthorizationCodes().save(authorizationCode, new AuthorizationCode(
                pending.getClientId(), redirectUri, pending.getCodeChallenge(), pending.getScopes(), targetUrl,
                session, tokens.toTokens(now), pending.getUpstreamClientId(), now));

        logger.info("Upstream login complete for user {} on site {}, issued authorization code to client {}",
                session.getUserName(), session.getSiteId(), pending.getClientId());

        Map<String, String> params = new LinkedHashMap<>();
        params.put("code", authorizationCode);
        if (!clientState.isEmpty()) {
            params.put("state", clientState);
        }
        return UriQueries.append(redirectUri, params);
    }

    private List<String> resolveScopes(String scope, String redirectUri, String state) {
        List<String> requested = Scopes.parse(scope);
        if (requested.isEmpty()) {
            return List.of(Scopes.DEFAULT_SCOPE);
        }
        Set<String> known = new HashSet<>(Scopes.supported(true));
        known.add(Scopes.DEFAULT_SCOPE);
        for (String candidate : requested) {
            if (!known.contains(candidate)) {
                throw new OAuthRedirectException(redirectUri, OAuth2ErrorCodes.INVALID_SCOPE,
                        "Unsupported scope: " + candidate, state);
            }
        }
        return requested;
    }

    /**
     * The deployment that actually served the login. A reported {@code origin_host} must be
     * the configured server's host and resolve to public addresses.
     */
    private String resolveTargetUrl(String originHost, String redirectUri, String clientState) {
        if (isBlank(originHost)) {
            return settings.getTableauServer();
        }

        String configuredHost = URI.create(settings.getTableauServer()).getHost();
        URI originUri;
        try {
            originUri = new URI("https://" + originHost);
        } catch (URISyntaxException e) {
            throw new OAuthRedirectException(redirectUri, OAuth2ErrorCodes.INVALID_REQUEST,
                    "Invalid origin host", clientState);
        }
        if (originUri.getHost() == null || !originUri.getHost().equalsIgnoreCase(configuredHost)) {
            logger.warn("Upstream reported origin host {}, expected {}", originHost, configuredHost);
            throw new OAuthRedirectException(redirectUri, OAuth2ErrorCodes.INVALID_REQUEST,
                    "Invalid origin host: " + originHost + ". Expected: " + settings.getTableauServer(),
                    clientState);
        }
        try {
            hostVerifier.verify(originUri.getHost());
        } catch (DnsResolutionException e) {
            logger.warn("Origin host {} failed DNS verification: {}", originHost, e.getMessage());
            throw new OAuthRedirectException(redirectUri, OAuth2ErrorCodes.INVALID_REQUEST,
                    "Invalid origin host: " + originHost, clientState);
        }
        return "https://" + originHost.toLowerCase(Locale.ROOT);
    }

    private static OAuthRedirectException upstreamFailure(UpstreamException e, String redirectUri,
                                                          String description, String state) {
        String error = e.getStatus() >= 400 && e.getStatus() < 500
                ? OAuth2ErrorCodes.ACCESS_DENIED
                : OAuth2ErrorCodes.SERVER_ERROR;
        return new OAuthRedirectException(redirectUri, error, description, state);
    }

    /**
     * Name the upstream shows the user for this login, derived from the client's redirect URI.
     */
    static String deviceName(String redirectUri, String state) {
        String unknown = CLIENT_TYPE + " (Unknown agent)";
        URI uri;
        try {
            uri = new URI(redirectUri);
        } catch (URISyntaxException e) {
            return unknown;
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (scheme.isEmpty()) {
            return unknown;
        }
        if ("https".equals(scheme) || "http".equals(scheme)) {
            // VS Code's URL-handler fallback is the only web redirect that identifies its agent.
            if (VSCODE_REDIRECT_URI.equals(redirectUri) && state != null
                    && state.toLowerCase(Locale.ROOT).startsWith("vscode:")) {
                return CLIENT_TYPE + " (VS Code)";
            }
            return unknown;
        }
        if ("cursor".equals(scheme)) {
            return CLIENT_TYPE + " (Cursor)";
        }
        return CLIENT_TYPE + " (" + scheme + ")";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
