package com.numaansystems.mcpauth.controller;

import com.numaansystems.mcpauth.service.AuthorizationService;
import com.numaansystems.mcpauth.service.AuthorizeRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

/**
 * Browser-facing half of the login: {@code /oauth/authorize} sends the user agent to
 * Tableau, and Tableau sends it back to {@code /Callback}.
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@Tag(name = "Authorization", description = "Authorization code flow with PKCE")
public class AuthorizationController {

    private final AuthorizationService authorizationService;

    public AuthorizationController(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @GetMapping("/oauth/authorize")
    @Operation(summary = "Start an authorization code flow")
    public ResponseEntity<Void> authorize(@RequestParam(name = "client_id", required = false) String clientId,
                                          @RequestParam(name = "redirect_uri", required = false) String redirectUri,
                                          @RequestParam(name = "response_type", required = false) String responseType,
                                          @RequestParam(name = "code_challenge", required = false) String codeChallenge,
                                          @RequestParam(name = "code_challenge_method", required = false)
                                          String codeChallengeMethod,
                                          @RequestParam(name = "state", required = false) String state,
                                          @RequestParam(name = "scope", required = false) String scope) {
        URI upstream = authorizationService.authorize(new AuthorizeRequest(
                clientId, redirectUri, responseType, codeChallenge, codeChallengeMethod, state, scope));
        return redirect(upstream);
    }

    @GetMapping("/Callback")
    @Operation(summary = "Upstream identity provider callback")
    public ResponseEntity<Void> callback(@RequestParam(name = "code", required = false) String code,
                                         @RequestParam(name = "state", required = false) String state,
                                         @RequestParam(name = "error", required = false) String error,
                                         @RequestParam(name = "error_description", required = false)
                                         String errorDescription) {
        return redirect(authorizationService.handleCallback(code, state, error, errorDescription));
    }

    static ResponseEntity<Void> redirect(URI location) {
        return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
    }
}
