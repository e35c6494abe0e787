package com.numaansystems.mcpauth.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authorization server settings, bound from {@code application.yml} and the environment.
 *
 * <p>Validated once at startup. Any violation throws {@link IllegalStateException} so the
 * application context fails to start instead of serving with a broken configuration.</p>
 *
 * <h2>Required</h2>
 * <ul>
 *   <li>{@code OAUTH_ISSUER}</li>
 *   <li>exactly one of {@code OAUTH_JWE_PRIVATE_KEY} or {@code OAUTH_JWE_PRIVATE_KEY_PATH}</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class OAuthSettings {

    private static final Logger logger = LoggerFactory.getLogger(OAuthSettings.class);

    @Value("${mcp.server-name:tableau-mcp}")
    private String serverName;

    @Value("${mcp.oauth.issuer:}")
    private String issuer;

    @Value("${mcp.oauth.redirect-uri:}")
    private String redirectUri;

    @Value("${mcp.oauth.jwe-private-key:}")
    private String jwePrivateKey;

    @Value("${mcp.oauth.jwe-private-key-path:}")
    private String jwePrivateKeyPath;

    @Value("${mcp.oauth.jwe-private-key-passphrase:}")
    private String jwePrivateKeyPassphrase;

    @Value("${mcp.oauth.client-id-secret-pairs:}")
    private String clientIdSecretPairs;

    @Value("${mcp.oauth.advertise-api-scopes:false}")
    private boolean advertiseApiScopes;

    @Value("${mcp.oauth.pending-authorization-ttl-ms:600000}")
    private long pendingAuthorizationTtlMs;

    @Value("${mcp.oauth.authorization-code-ttl-ms:120000}")
    private long authorizationCodeTtlMs;

    @Value("${mcp.oauth.access-token-ttl-ms:3600000}")
    private long accessTokenTtlMs;

    @Value("${mcp.oauth.refresh-token-ttl-ms:2592000000}")
    private long refreshTokenTtlMs;

    @Value("${mcp.oauth.client-registration-ttl-ms:600000}")
    private long clientRegistrationTtlMs;

    @Value("${mcp.oauth.dns-servers:1.1.1.1,1.0.0.1}")
    private List<String> dnsServers;

    @Value("${mcp.oauth.dns-timeout-ms:5000}")
    private long dnsTimeoutMs;

    @Value("${mcp.oauth.upstream-timeout-ms:10000}")
    private long upstreamTimeoutMs;

    @Value("${mcp.oauth.sweep-interval-ms:60000}")
    private long sweepIntervalMs;

    @Value("${mcp.tableau.server:https://online.tableau.com}")
    private String tableauServer;

    @Value("${mcp.tableau.site-name:}")
    private String siteName;

    private Map<String, String> parsedClientPairs = Collections.emptyMap();

    /**
     * Checks required settings and parses the static client list.
     *
     * @throws IllegalStateException if the configuration cannot be served
     */
    @PostConstruct
    public void validate() {
        if (isBlank(issuer)) {
            throw new IllegalStateException("The environment variable OAUTH_ISSUER is not set");
        }
        issuer = stripTrailingSlash(issuer.trim());

        boolean hasInlineKey = !isBlank(jwePrivateKey);
        boolean hasKeyPath = !isBlank(jwePrivateKeyPath);
        if (!hasInlineKey && !hasKeyPath) {
            throw new IllegalStateException(
                    "One of the environment variables: OAUTH_JWE_PRIVATE_KEY or OAUTH_JWE_PRIVATE_KEY_PATH must be set");
        }
        if (hasInlineKey && hasKeyPath) {
            throw new IllegalStateException(
                    "Only one of the environment variables: OAUTH_JWE_PRIVATE_KEY or OAUTH_JWE_PRIVATE_KEY_PATH must be set");
        }

        if (isBlank(redirectUri)) {
            redirectUri = issuer + "/Callback";
        }
        if (isBlank(tableauServer)) {
            throw new IllegalStateException("The Tableau server URL (SERVER) is not set");
        }
        tableauServer = stripTrailingSlash(tableauServer.trim());

        parsedClientPairs = parseClientIdSecretPairs(clientIdSecretPairs);

        logger.info("OAuth settings loaded: issuer={}, redirectUri={}, upstream={}, staticClients={}, advertiseApiScopes={}",
                issuer, redirectUri, tableauServer, parsedClientPairs.size(), advertiseApiScopes);
    }

    /**
     * Parses {@code id:secret,id:secret,...}. Whitespace around entries is ignored; the
     * secret may itself contain ':'.
     */
    static Map<String, String> parseClientIdSecretPairs(String raw) {
        if (isBlank(raw)) {
            return Collections.emptyMap();
        }
        Map<String, String> pairs = new LinkedHashMap<>();
        for (String entry : raw.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int separator = trimmed.indexOf(':');
            if (separator <= 0 || separator == trimmed.length() - 1) {
                throw new IllegalStateException(
                        "OAUTH_CLIENT_ID_SECRET_PAIRS must be a comma-separated list of clientId:secret pairs");
            }
            pairs.put(trimmed.substring(0, separator), trimmed.substring(separator + 1));
        }
        return Collections.unmodifiableMap(pairs);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    public String getServerName() {
        return serverName;
    }

    public String getIssuer() {
        return issuer;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public String getJwePrivateKey() {
        return jwePrivateKey;
    }

    public String getJwePrivateKeyPath() {
        return jwePrivateKeyPath;
    }

    public String getJwePrivateKeyPassphrase() {
        return jwePrivateKeyPassphrase;
    }

    public Map<String, String> getClientIdSecretPairs() {
        return parsedClientPairs;
    }

    public boolean isAdvertiseApiScopes() {
        return advertiseApiScopes;
    }

    public Duration getPendingAuthorizationTtl() {
        return Duration.ofMillis(pendingAuthorizationTtlMs);
    }

    public Duration getAuthorizationCodeTtl() {
        return Duration.ofMillis(authorizationCodeTtlMs);
    }

    public Duration getAccessTokenTtl() {
        return Duration.ofMillis(accessTokenTtlMs);
    }

    public Duration getRefreshTokenTtl() {
        return Duration.ofMillis(refreshTokenTtlMs);
    }

    public Duration getClientRegistrationTtl() {
        return Duration.ofMillis(clientRegistrationTtlMs);
    }

    public List<String> getDnsServers() {
        return dnsServers;
    }

    public Duration getDnsTimeout() {
        return Duration.ofMillis(dnsTimeoutMs);
    }

    public Duration getUpstreamTimeout() {
        return Duration.ofMillis(upstreamTimeoutMs);
    }

    public Duration getSweepInterval() {
        return Duration.ofMillis(sweepIntervalMs);
    }

    public String getTableauServer() {
        return tableauServer;
    }

    public String getSiteName() {
        return siteName;
    }

    public String getResource() {
        return issuer + "/" + serverName;
    }

    public String getProtectedResourceMetadataUrl() {
        return issuer + "/.well-known/oauth-protected-resource";
    }
}
