package com.numaansystems.mcpauth.crypto;

import com.nimbusds.jose.EncryptionMethod;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWEAlgorithm;
import com.nimbusds.jose.JWEHeader;
import com.nimbusds.jose.crypto.RSADecrypter;
import com.nimbusds.jose.crypto.RSAEncrypter;
import com.nimbusds.jwt.EncryptedJWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.numaansystems.mcpauth.model.AccessTokenClaims;
import com.numaansystems.mcpauth.model.Scopes;

import java.security.KeyPair;
import java.security.interfaces.RSAPublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Mints and reads the encrypted bearer tokens handed to MCP clients.
 *
 * <p>Tokens are compact JWEs ({@code RSA-OAEP-256} / {@code A256GCM}) whose payload is a
 * JWT claim set. Minting only needs the public key; reading needs the private key, so a
 * token is opaque to everyone but this server. Nothing is stored server-side: validation
 * is decrypt, then check {@code iss}, {@code aud} and {@code exp}.</p>
 */
public class AccessTokenCodec {

    public static final String CLAIM_SCOPE = "scope";
    public static final String CLAIM_CLIENT_ID = "client_id";
    public static final String CLAIM_SITE_ID = "tableau.com/siteId";
    public static final String CLAIM_TARGET_URL = "tableau.com/targetUrl";
    public static final String CLAIM_UPSTREAM_USER_ID = "tableau.com/userId";
    public static final String CLAIM_UPSTREAM_ACCESS_TOKEN = "tableau.com/accessToken";
    public static final String CLAIM_UPSTREAM_REFRESH_TOKEN = "tableau.com/refreshToken";
    public static final String CLAIM_UPSTREAM_EXPIRES_AT = "tableau.com/expiresAt";

    private static final JWEAlgorithm ALGORITHM = JWEAlgorithm.RSA_OAEP_256;
    private static final EncryptionMethod ENCRYPTION = EncryptionMethod.A256GCM;

    private final RSAEncrypter encrypter;
    private final RSADecrypter decrypter;
    private final String issuer;
    private final String audience;
    private final Clock clock;

    public AccessTokenCodec(KeyPair keyPair, String issuer, String audience, Clock clock) {
        this.encrypter = new RSAEncrypter((RSAPublicKey) keyPair.getPublic());
        this.decrypter = new RSADecrypter(keyPair.getPrivate());
        this.issuer = issuer;
        this.audience = audience;
        this.clock = clock;
    }

    /**
     * Encrypts the claim set into a compact JWE string.
     */
    public String encrypt(AccessTokenClaims claims) {
        JWTClaimsSet.Builder builder = new JWTClaimsSet.Builder()
                .issuer(claims.getIssuer())
                .audience(claims.getAudience())
                .subject(claims.getSubject())
                .issueTime(Date.from(claims.getIssuedAt()))
                .expirationTime(Date.from(claims.getExpiresAt()))
                .claim(CLAIM_SCOPE, Scopes.format(claims.getScopes()));

        putIfPresent(builder, CLAIM_CLIENT_ID, claims.getClientId());
        putIfPresent(builder, CLAIM_SITE_ID, claims.getSiteId());
        putIfPresent(builder, CLAIM_TARGET_URL, claims.getTargetUrl());
        putIfPresent(builder, CLAIM_UPSTREAM_USER_ID, claims.getUpstreamUserId());
        putIfPresent(builder, CLAIM_UPSTREAM_ACCESS_TOKEN, claims.getUpstreamAccessToken());
        putIfPresent(builder, CLAIM_UPSTREAM_REFRESH_TOKEN, claims.getUpstreamRefreshToken());
        if (claims.getUpstreamExpiresAt() != null) {
            builder.claim(CLAIM_UPSTREAM_EXPIRES_AT, claims.getUpstreamExpiresAt().getEpochSecond());
        }

        EncryptedJWT jwt = new EncryptedJWT(new JWEHeader(ALGORITHM, ENCRYPTION), builder.build());
        try {
            jwt.encrypt(encrypter);
        } catch (JOSEException e) {
            throw new IllegalStateException("Unable to encrypt access token", e);
        }
        return jwt.serialize();
    }

    /**
     * Decrypts a bearer token and validates issuer, audience and expiry.
     *
     * @throws InvalidAccessTokenException if the token is malformed, undecryptable,
     *         issued for another audience or issuer, or expired
     */
    public AccessTokenClaims decrypt(String token) throws InvalidAccessTokenException {
        if (token == null || token.isBlank()) {
            throw new InvalidAccessTokenException("Missing access token");
        }

        JWTClaimsSet claims;
        try {
            EncryptedJWT jwt = EncryptedJWT.parse(token);
            if (!ALGORITHM.equals(jwt.getHeader().getAlgorithm())
                    || !ENCRYPTION.equals(jwt.getHeader().getEncryptionMethod())) {
                throw new InvalidAccessTokenException("Unsupported access token encryption");
            }
            jwt.decrypt(decrypter);
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException | JOSEException | IllegalStateException e) {
            throw new InvalidAccessTokenException("Invalid or expired access token", e);
        }

        if (!issuer.equals(claims.getIssuer())) {
            throw new InvalidAccessTokenException("Invalid or expired access token");
        }
        List<String> audiences = claims.getAudience();
        if (audiences == null || !audiences.contains(audience)) {
            throw new InvalidAccessTokenException("Invalid or expired access token");
        }
        Date expiration = claims.getExpirationTime();
        Instant now = clock.instant();
        if (expiration == null || !expiration.toInstant().isAfter(now)) {
            throw new InvalidAccessTokenException("Invalid or expired access token");
        }

        try {
            String scope = claims.getStringClaim(CLAIM_SCOPE);
            Long upstreamExpiresAt = claims.getLongClaim(CLAIM_UPSTREAM_EXPIRES_AT);
            return AccessTokenClaims.builder()
                    .issuer(claims.getIssuer())
                    .audience(audience)
                    .subject(claims.getSubject())
                    .clientId(claims.getStringClaim(CLAIM_CLIENT_ID))
                    .scopes(Scopes.parse(scope))
                    .issuedAt(claims.getIssueTime() == null ? null : claims.getIssueTime().toInstant())
                    .expiresAt(expiration.toInstant())
                    .siteId(claims.getStringClaim(CLAIM_SITE_ID))
                    .targetUrl(claims.getStringClaim(CLAIM_TARGET_URL))
                    .upstreamUserId(claims.getStringClaim(CLAIM_UPSTREAM_USER_ID))
                    .upstreamAccessToken(claims.getStringClaim(CLAIM_UPSTREAM_ACCESS_TOKEN))
                    .upstreamRefreshToken(claims.getStringClaim(CLAIM_UPSTREAM_REFRESH_TOKEN))
                    .upstreamExpiresAt(upstreamExpiresAt == null ? null : Instant.ofEpochSecond(upstreamExpiresAt))
                    .build();
        } catch (ParseException e) {
            throw new InvalidAccessTokenException("Invalid access token claims", e);
        }
    }

    private static void putIfPresent(JWTClaimsSet.Builder builder, String name, String value) {
        if (value != null) {
            builder.claim(name, value);
        }
    }
}
