package com.numaansystems.mcpauth.controller;

import com.numaansystems.mcpauth.config.OAuthProvider;
import com.numaansystems.mcpauth.config.OAuthSettings;
import com.numaansystems.mcpauth.service.ClientRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/oauth")
@Tag(name = "Health")
public class HealthController {

    private final OAuthProvider provider;
    private final ClientRegistry clientRegistry;
    private final OAuthSettings settings;

    public HealthController(OAuthProvider provider, ClientRegistry clientRegistry, OAuthSettings settings) {
        this.provider = provider;
        this.clientRegistry = clientRegistry;
        this.settings = settings;
    }

    /**
     * Liveness plus store sizes. Sizes may include expired entries not yet swept.
     */
    @GetMapping("/health")
    @Operation(summary = "Health check")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthInfo = new LinkedHashMap<>();
        healthInfo.put("status", "UP");
        healthInfo.put("service", settings.getServerName());
        healthInfo.put("pendingAuthorizations", provider.getPendingAuthorizations().size());
        healthInfo.put("authorizationCodes", provider.getAuthorizationCodes().size());
        healthInfo.put("refreshTokens", provider.getRefreshTokens().size());
        healthInfo.put("registeredClients", clientRegistry.size());
        return ResponseEntity.ok(healthInfo);
    }
}
