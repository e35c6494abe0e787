package com.numaansystems.mcpauth.controller;

import com.numaansystems.mcpauth.config.OAuthSettings;
import com.numaansystems.mcpauth.crypto.Pkce;
import com.numaansystems.mcpauth.model.Scopes;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.core.AuthorizationGrantType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discovery documents: protected-resource metadata (RFC 9728) and authorization-server
 * metadata (RFC 8414). Both are built from configuration only.
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@Tag(name = "Discovery", description = "OAuth metadata documents")
public class WellKnownController {

    private final OAuthSettings settings;

    public WellKnownController(OAuthSettings settings) {
        this.settings = settings;
    }

    @GetMapping({"/.well-known/oauth-protected-resource", "/.well-known/oauth-protected-resource/${mcp.server-name:tableau-mcp}"})
    @Operation(summary = "Protected resource metadata")
    public ResponseEntity<Map<String, Object>> protectedResource() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("resource", settings.getResource());
        metadata.put("authorization_servers", List.of(settings.getIssuer()));
        metadata.put("bearer_methods_supported", List.of("header"));
        metadata.put("scopes_supported", Scopes.supported(settings.isAdvertiseApiScopes()));
        return ResponseEntity.ok(metadata);
    }

    @GetMapping("/.well-known/oauth-authorization-server")
    @Operation(summary = "Authorization server metadata")
    public ResponseEntity<Map<String, Object>> authorizationServer() {
        String issuer = settings.getIssuer();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("issuer", issuer);
        metadata.put("authorization_endpoint", issuer + "/oauth/authorize");
        metadata.put("token_endpoint", issuer + "/oauth/token");
        metadata.put("registration_endpoint", issuer + "/oauth/register");
        metadata.put("response_types_supported", List.of("code"));
        metadata.put("grant_types_supported", List.of(
                AuthorizationGrantType.AUTHORIZATION_CODE.getValue(),
                AuthorizationGrantType.REFRESH_TOKEN.getValue(),
                AuthorizationGrantType.CLIENT_CREDENTIALS.getValue()));
        metadata.put("code_challenge_methods_supported", List.of(Pkce.METHOD_S256));
        metadata.put("token_endpoint_auth_methods_supported", List.of("client_secret_basic"));
        metadata.put("subject_types_supported", List.of("public"));
        metadata.put("scopes_supported", Scopes.supported(settings.isAdvertiseApiScopes()));
        return ResponseEntity.ok(metadata);
    }
}
