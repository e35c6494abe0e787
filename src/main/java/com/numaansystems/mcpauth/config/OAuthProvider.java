package com.numaansystems.mcpauth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.mcpauth.crypto.AccessTokenCodec;
import com.numaansystems.mcpauth.crypto.JweKeyLoader;
import com.numaansystems.mcpauth.security.BearerTokenAuthenticationFilter;
import com.numaansystems.mcpauth.service.ClientRegistry;
import com.numaansystems.mcpauth.store.AuthorizationCodeStore;
import com.numaansystems.mcpauth.store.PendingAuthorizationStore;
import com.numaansystems.mcpauth.store.RefreshTokenStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.servlet.Filter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.KeyPair;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns the state of the authorization server for the life of the process: the JWE
 * keypair, the three flow-stage stores and the bearer-token middleware.
 *
 * <h2>Flow stages</h2>
 * <ol>
 *   <li>{@link PendingAuthorizationStore}: authorize requests waiting for the upstream callback</li>
 *   <li>{@link AuthorizationCodeStore}: codes waiting to be redeemed at the token endpoint</li>
 *   <li>{@link RefreshTokenStore}: refresh tokens handed to clients</li>
 * </ol>
 *
 * <p>Expired entries are unreachable as soon as their TTL passes. A single background
 * thread also purges them every {@code mcp.oauth.sweep-interval-ms} to reclaim memory.</p>
 *
 * <p>The keypair is loaded in the constructor; a missing or broken key fails the
 * application context before any route is served.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class OAuthProvider {

    private static final Logger logger = LoggerFactory.getLogger(OAuthProvider.class);

    /** Audience of every access token this server mints, and the only one it accepts. */
    public static final String AUDIENCE = "tableau-mcp-server";

    private final OAuthSettings settings;
    private final ClientRegistry clientRegistry;
    private final AccessTokenCodec accessTokenCodec;
    private final PendingAuthorizationStore pendingAuthorizations;
    private final AuthorizationCodeStore authorizationCodes;
    private final RefreshTokenStore refreshTokens;
    private final BearerTokenAuthenticationFilter authMiddleware;
    private ScheduledExecutorService sweeper;

    public OAuthProvider(OAuthSettings settings, ClientRegistry clientRegistry, Clock clock,
                         ObjectMapper objectMapper) {
        this.settings = settings;
        this.clientRegistry = clientRegistry;

        KeyPair keyPair = JweKeyLoader.load(settings.getJwePrivateKey(), settings.getJwePrivateKeyPath(),
                settings.getJwePrivateKeyPassphrase());
        this.accessTokenCodec = new AccessTokenCodec(keyPair, settings.getIssuer(), AUDIENCE, clock);

        this.pendingAuthorizations = new PendingAuthorizationStore(settings.getPendingAuthorizationTtl(), clock);
        this.authorizationCodes = new AuthorizationCodeStore(settings.getAuthorizationCodeTtl(), clock);
        this.refreshTokens = new RefreshTokenStore(settings.getRefreshTokenTtl(), clock);

        this.authMiddleware = new BearerTokenAuthenticationFilter(accessTokenCodec, settings, clock, objectMapper);
    }

    @PostConstruct
    public void startSweeper() {
        long intervalMs = settings.getSweepInterval().toMillis();
        if (intervalMs <= 0) {
            logger.info("Periodic sweep of expired OAuth state disabled");
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "oauth-state-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        sweeper.scheduleWithFixedDelay(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("Sweeping expired OAuth state every {} ms", intervalMs);
    }

    /**
     * Purges expired entries from every store.
     *
     * @return the number of entries removed
     */
    public int sweep() {
        try {
            int removed = pendingAuthorizations.purgeExpired()
                    + authorizationCodes.purgeExpired()
                    + refreshTokens.purgeExpired()
                    + clientRegistry.purgeExpired();
            if (removed > 0) {
                logger.debug("Swept {} expired OAuth entries", removed);
            }
            return removed;
        } catch (RuntimeException e) {
            // A failure here must not cancel the scheduled task.
            logger.error("Sweep of expired OAuth state failed", e);
            return 0;
        }
    }

    @PreDestroy
    public void shutdown() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    /**
     * Middleware for the protected MCP route: rejects requests without a valid bearer
     * token and exposes {@code AuthInfo} to the handlers behind it.
     */
    public Filter authMiddleware() {
        return authMiddleware;
    }

    public AccessTokenCodec getAccessTokenCodec() {
        return accessTokenCodec;
    }

    public PendingAuthorizationStore getPendingAuthorizations() {
        return pendingAuthorizations;
    }

    public AuthorizationCodeStore getAuthorizationCodes() {
        return authorizationCodes;
    }

    public RefreshTokenStore getRefreshTokens() {
        return refreshTokens;
    }

    public String getIssuer() {
        return settings.getIssuer();
    }
}
