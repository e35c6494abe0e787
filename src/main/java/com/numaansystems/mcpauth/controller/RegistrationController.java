package com.numaansystems.mcpauth.controller;

import com.numaansystems.mcpauth.model.RegisteredClient;
import com.numaansystems.mcpauth.service.ClientRegistry;
import com.numaansystems.mcpauth.service.OAuthException;
import com.numaansystems.mcpauth.service.RedirectUriPolicy;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dynamic client registration (RFC 7591).
 *
 * <p>{@code token_endpoint_auth_method=none} registers a public client; any other supported
 * method, or none given, registers a confidential client and returns its secret once.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@RequestMapping("/oauth")
@Tag(name = "Registration", description = "Dynamic client registration")
public class RegistrationController {

    static final String AUTH_METHOD_NONE = "none";
    static final String AUTH_METHOD_BASIC = "client_secret_basic";
    private static final Set<String> AUTH_METHODS = Set.of(AUTH_METHOD_NONE, AUTH_METHOD_BASIC, "client_secret_post");

    private final ClientRegistry clientRegistry;

    public RegistrationController(ClientRegistry clientRegistry) {
        this.clientRegistry = clientRegistry;
    }

    @PostMapping("/register")
    @Operation(summary = "Register a client")
    public ResponseEntity<Map<String, Object>> register(@RequestBody Map<String, Object> metadata) {
        List<String> redirectUris = redirectUris(metadata.get("redirect_uris"));

        Object requestedMethod = metadata.get("token_endpoint_auth_method");
        String authMethod = requestedMethod == null ? AUTH_METHOD_BASIC : requestedMethod.toString();
        if (!AUTH_METHODS.contains(authMethod)) {
            throw new OAuthException(OAuthException.INVALID_CLIENT_METADATA,
                    "Unsupported token_endpoint_auth_method: " + authMethod, HttpStatus.BAD_REQUEST);
        }
        boolean confidential = !AUTH_METHOD_NONE.equals(authMethod);

        RegisteredClient client = clientRegistry.register(redirectUris, confidential);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("client_id", client.getClientId());
        if (client.isConfidential()) {
            response.put("client_secret", client.getClientSecret());
            response.put("client_secret_expires_at", 0);
        }
        response.put("client_id_issued_at", client.getRegisteredAt().getEpochSecond());
        response.put("redirect_uris", client.getRedirectUris());
        response.put("grant_types", confidential
                ? List.of("authorization_code", "refresh_token", "client_credentials")
                : List.of("authorization_code", "refresh_token"));
        response.put("response_types", List.of("code"));
        response.put("token_endpoint_auth_method", authMethod);
        if (metadata.get("client_name") instanceof String clientName) {
            response.put("client_name", clientName);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .cacheControl(CacheControl.noStore())
                .body(response);
    }

    private static List<String> redirectUris(Object value) {
        if (!(value instanceof List<?> values) || values.isEmpty()) {
            throw new OAuthException(OAuthException.INVALID_CLIENT_METADATA,
                    "redirect_uris must be a non-empty array", HttpStatus.BAD_REQUEST);
        }
        List<String> uris = new ArrayList<>();
        for (Object uri : values) {
            if (!(uri instanceof String candidate)) {
                throw new OAuthException(OAuthException.INVALID_REDIRECT_URI,
                        "redirect_uris must be an array of strings", HttpStatus.BAD_REQUEST);
            }
            if (!RedirectUriPolicy.isAllowed(candidate)) {
                throw new OAuthException(OAuthException.INVALID_REDIRECT_URI,
                        "Invalid redirect URI: " + candidate + ". Must use HTTPS, localhost HTTP, or custom scheme",
                        HttpStatus.BAD_REQUEST);
            }
            uris.add(candidate);
        }
        return uris;
    }
}
