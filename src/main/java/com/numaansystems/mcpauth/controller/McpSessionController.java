package com.numaansystems.mcpauth.controller;

import com.numaansystems.mcpauth.security.AuthInfo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports who the bearer token belongs to. Lives under the protected MCP path, so it
 * is only reached through the bearer middleware.
 */
@RestController
@RequestMapping("/${mcp.server-name:tableau-mcp}")
@Tag(name = "MCP", description = "Protected MCP routes")
public class McpSessionController {

    @GetMapping("/session")
    @Operation(summary = "Identity behind the current bearer token")
    public ResponseEntity<Map<String, Object>> session(@AuthenticationPrincipal AuthInfo authInfo) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("subject", authInfo.getSubject());
        response.put("clientId", authInfo.getClientId());
        response.put("scopes", authInfo.getScopes());
        response.put("siteId", authInfo.getSiteId());
        response.put("targetUrl", authInfo.getTargetUrl());
        response.put("userId", authInfo.getUpstreamUserId());
        response.put("expiresAt", authInfo.getExpiresAt() == null ? null : authInfo.getExpiresAt().toString());
        return ResponseEntity.ok(response);
    }
}
