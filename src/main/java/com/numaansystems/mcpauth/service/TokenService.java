package com.numaansystems.mcpauth.service;

import com.numaansystems.mcpauth.config.OAuthProvider;
import com.numaansystems.mcpauth.config.OAuthSettings;
import com.numaansystems.mcpauth.crypto.Pkce;
import com.numaansystems.mcpauth.crypto.RandomTokens;
import com.numaansystems.mcpauth.model.AccessTokenClaims;
import com.numaansystems.mcpauth.model.AuthorizationCode;
import com.numaansystems.mcpauth.model.RefreshTokenData;
import com.numaansystems.mcpauth.model.RegisteredClient;
import com.numaansystems.mcpauth.model.Scopes;
import com.numaansystems.mcpauth.model.UpstreamTokens;
import com.numaansystems.mcpauth.upstream.TableauOAuthClient;
import com.numaansystems.mcpauth.upstream.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.core.AuthorizationGrantType;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Token endpoint grants: {@code authorization_code}, {@code refresh_token} and
 * {@code client_credentials}.
 *
 * <p>Every grant authenticates the client first. Codes and refresh tokens are removed
 * from their store before they are checked, so each can be redeemed at most once even
 * under concurrent requests.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class TokenService {

    private static final Logger logger = LoggerFactory.getLogger(TokenService.class);

    private final OAuthProvider provider;
    private final ClientRegistry clientRegistry;
    private final OAuthSettings settings;
    private final TableauOAuthClient tableauClient;
    private final Clock clock;

    public TokenService(OAuthProvider provider, ClientRegistry clientRegistry, OAuthSettings settings,
                        TableauOAuthClient tableauClient, Clock clock) {
        this.provider = provider;
        this.clientRegistry = clientRegistry;
        this.settings = settings;
        this.tableauClient = tableauClient;
        this.clock = clock;
    }

    /**
     * Runs the grant named by {@code grant_type}.
     *
     * @param params form or JSON body parameters
     * @param credentials client credentials from Basic auth or the body
     * @throws OAuthException with the RFC 6749 error for any rejected request
     */
    public TokenResponse exchange(Map<String, String> params, ClientCredentials credentials) {
        String grantType = params.get("grant_type");
        if (isBlank(grantType)) {
            throw OAuthException.invalidRequest("grant_type is required");
        }
        boolean supported = AuthorizationGrantType.AUTHORIZATION_CODE.getValue().equals(grantType)
                || AuthorizationGrantType.REFRESH_TOKEN.getValue().equals(grantType)
                || AuthorizationGrantType.CLIENT_CREDENTIALS.getValue().equals(grantType);
        if (!supported) {
            throw new OAuthException(OAuth2ErrorCodes.UNSUPPORTED_GRANT_TYPE,
                    "Unsupported grant type: " + grantType, HttpStatus.BAD_REQUEST);
        }
        if (!credentials.hasClientId()) {
            throw OAuthException.invalidClient("Client authentication is required");
        }

        if (AuthorizationGrantType.AUTHORIZATION_CODE.getValue().equals(grantType)) {
            return authorizationCode(params, credentials);
        }
        if (AuthorizationGrantType.REFRESH_TOKEN.getValue().equals(grantType)) {
            return refreshToken(params, credentials);
        }
        return clientCredentials(credentials);
    }

    private TokenResponse authorizationCode(Map<String, String> params, ClientCredentials credentials) {
        String code = require(params, "code");
        String redirectUri = require(params, "redirect_uri");
        String codeVerifier = require(params, "code_verifier");

        RegisteredClient client = clientRegistry.authenticate(credentials);

        AuthorizationCode authorizationCode = provider.getAuthorizationCodes().consume(code)
                .orElseThrow(() -> {
                    logger.warn("Client {} presented an unknown, expired or already used code", client.getClientId());
                    return OAuthException.invalidGrant("Invalid or expired authorization code");
                });
        if (!authorizationCode.getClientId().equals(client.getClientId())) {
            logger.warn("Client {} presented a code issued to another client", client.getClientId());
            throw OAuthException.invalidGrant("Invalid or expired authorization code");
        }
        if (!authorizationCode.getRedirectUri().equals(redirectUri)) {
            throw OAuthException.invalidGrant("redirect_uri does not match the authorization request");
        }
        if (!Pkce.verify(codeVerifier, authorizationCode.getCodeChallenge())) {
            logger.warn("PKCE verification failed for client {}", client.getClientId());
            throw OAuthException.invalidGrant("Invalid code verifier");
        }

        Instant now = clock.instant();
        RefreshTokenData refreshData = new RefreshTokenData(client.getClientId(), authorizationCode.getScopes(),
                authorizationCode.getTargetUrl(), authorizationCode.getSession(), authorizationCode.getTokens(),
                authorizationCode.getUpstreamClientId(), now);
        String refreshToken = issueRefreshToken(refreshData);
        String accessToken = mintUserToken(refreshData, now);

        logger.info("Issued tokens to client {} for user {} (authorization_code)",
                client.getClientId(), refreshData.getSubject());
        return new TokenResponse(accessToken, expiresInSeconds(), refreshToken,
                Scopes.format(refreshData.getScopes()));
    }

    private TokenResponse refreshToken(Map<String, String> params, ClientCredentials credentials) {
        String refreshToken = require(params, "refresh_token");
        RegisteredClient client = clientRegistry.authenticate(credentials);

        RefreshTokenData current = provider.getRefreshTokens().find(refreshToken)
                .orElseThrow(() -> OAuthException.invalidGrant("Invalid or expired refresh token"));
        if (!current.getClientId().equals(client.getClientId())) {
            logger.warn("Client {} presented a refresh token issued to another client", client.getClientId());
            throw OAuthException.invalidGrant("Invalid or expired refresh token");
        }
        RefreshTokenData consumed = provider.getRefreshTokens().consume(refreshToken)
                .orElseThrow(() -> OAuthException.invalidGrant("Invalid or expired refresh token"));

        Instant now = clock.instant();
        UpstreamTokens upstreamTokens = refreshUpstream(consumed, now);
        RefreshTokenData rotated = consumed.withTokens(upstreamTokens, now);
        String newRefreshToken = issueRefreshToken(rotated);
        String accessToken = mintUserToken(rotated, now);

        logger.info("Issued tokens to client {} for user {} (refresh_token)",
                client.getClientId(), rotated.getSubject());
        return new TokenResponse(accessToken, expiresInSeconds(), newRefreshToken,
                Scopes.format(rotated.getScopes()));
    }

    private TokenResponse clientCredentials(ClientCredentials credentials) {
        RegisteredClient client = clientRegistry.authenticate(credentials);
        if (!client.isConfidential()) {
            logger.warn("Public client {} attempted the client_credentials grant", client.getClientId());
            throw OAuthException.invalidClient(ClientRegistry.INVALID_CREDENTIALS);
        }

        Instant now = clock.instant();
        List<String> scopes = List.of(Scopes.DEFAULT_SCOPE);
        String accessToken = provider.getAccessTokenCodec().encrypt(AccessTokenClaims.builder()
                .issuer(settings.getIssuer())
                .audience(OAuthProvider.AUDIENCE)
                .subject(client.getClientId())
                .clientId(client.getClientId())
                .scopes(scopes)
                .issuedAt(now)
                .expiresAt(now.plus(settings.getAccessTokenTtl()))
                .build());

        logger.info("Issued access token to client {} (client_credentials)", client.getClientId());
        return new TokenResponse(accessToken, expiresInSeconds(), null, Scopes.format(scopes));
    }

    /**
     * Refreshes the upstream tokens; when the upstream refuses, the stored tokens are reused
     * and the middleware rejects the access token once they expire.
     */
    private UpstreamTokens refreshUpstream(RefreshTokenData data, Instant now) {
        UpstreamTokens stored = data.getTokens();
        if (stored == null || isBlank(stored.getRefreshToken())) {
            return stored;
        }
        try {
            return tableauClient.refresh(data.getTargetUrl(), stored.getRefreshToken(), data.getUpstreamClientId())
                    .toTokens(now);
        } catch (UpstreamException e) {
            logger.warn("Upstream token refresh failed for user {}, reusing stored upstream tokens: {}",
                    data.getSubject(), e.getMessage());
            return stored;
        }
    }

    private String issueRefreshToken(RefreshTokenData data) {
        String refreshToken = RandomTokens.generate();
        provider.getRefreshTokens().save(refreshToken, data);
        clientRegistry.retain(data.getClientId(), settings.getRefreshTokenTtl());
        return refreshToken;
    }

    private String mintUserToken(RefreshTokenData data, Instant now) {
        return provider.getAccessTokenCodec().encrypt(AccessTokenClaims.builder()
                .issuer(settings.getIssuer())
                .audience(OAuthProvider.AUDIENCE)
                .subject(data.getSubject())
                .clientId(data.getClientId())
                .scopes(data.getScopes())
                .issuedAt(now)
                .expiresAt(now.plus(settings.getAccessTokenTtl()))
                .siteId(data.getSession().getSiteId())
                .targetUrl(data.getTargetUrl())
                .upstreamUserId(data.getSession().getUserId())
                .upstreamTokens(data.getTokens())
                .build());
    }

    private long expiresInSeconds() {
        return settings.getAccessTokenTtl().toSeconds();
    }

    private static String require(Map<String, String> params, String name) {
        String value = params.get(name);
        if (isBlank(value)) {
            throw OAuthException.invalidRequest(name + " is required");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
