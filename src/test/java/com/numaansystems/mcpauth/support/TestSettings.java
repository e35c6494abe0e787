package com.numaansystems.mcpauth.support;

import com.numaansystems.mcpauth.config.OAuthSettings;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

/**
 * Builds validated {@link OAuthSettings} the way {@code @Value} injection would.
 */
public final class TestSettings {

    public static final String ISSUER = "https://mcp.example.com";
    public static final String TABLEAU_SERVER = "https://online.tableau.com";

    private TestSettings() {
    }

    public static OAuthSettings create(String clientIdSecretPairs) {
        OAuthSettings settings = new OAuthSettings();
        ReflectionTestUtils.setField(settings, "serverName", "tableau-mcp");
        ReflectionTestUtils.setField(settings, "issuer", ISSUER);
        ReflectionTestUtils.setField(settings, "redirectUri", "");
        ReflectionTestUtils.setField(settings, "jwePrivateKey", TestKeys.pkcs8Pem(TestKeys.rsa().getPrivate()));
        ReflectionTestUtils.setField(settings, "jwePrivateKeyPath", "");
        ReflectionTestUtils.setField(settings, "jwePrivateKeyPassphrase", "");
        ReflectionTestUtils.setField(settings, "clientIdSecretPairs", clientIdSecretPairs);
        ReflectionTestUtils.setField(settings, "pendingAuthorizationTtlMs", 600_000L);
        ReflectionTestUtils.setField(settings, "authorizationCodeTtlMs", 120_000L);
        ReflectionTestUtils.setField(settings, "accessTokenTtlMs", 3_600_000L);
        ReflectionTestUtils.setField(settings, "refreshTokenTtlMs", 2_592_000_000L);
        ReflectionTestUtils.setField(settings, "clientRegistrationTtlMs", 600_000L);
        ReflectionTestUtils.setField(settings, "dnsServers", List.of("1.1.1.1", "1.0.0.1"));
        ReflectionTestUtils.setField(settings, "dnsTimeoutMs", 5_000L);
        ReflectionTestUtils.setField(settings, "upstreamTimeoutMs", 10_000L);
        ReflectionTestUtils.setField(settings, "sweepIntervalMs", 0L);
        ReflectionTestUtils.setField(settings, "tableauServer", TABLEAU_SERVER);
        ReflectionTestUtils.setField(settings, "siteName", "acme");
        settings.validate();
        return settings;
    }
}
