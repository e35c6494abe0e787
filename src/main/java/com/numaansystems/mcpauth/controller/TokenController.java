package com.numaansystems.mcpauth.controller;

import com.numaansystems.mcpauth.service.ClientCredentials;
import com.numaansystems.mcpauth.service.OAuthException;
import com.numaansystems.mcpauth.service.TokenResponse;
import com.numaansystems.mcpauth.service.TokenService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Token endpoint. Accepts form-encoded (standard) or JSON bodies, with client
 * credentials in HTTP Basic auth or in the body.
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@RequestMapping("/oauth")
@Tag(name = "Token", description = "Token issuance")
public class TokenController {

    private static final String BASIC_PREFIX = "Basic ";

    private final TokenService tokenService;

    public TokenController(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @PostMapping(path = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Exchange a grant for tokens")
    public ResponseEntity<TokenResponse> tokenFromForm(
            @RequestParam MultiValueMap<String, String> form,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest request) {
        rejectQueryParameters(request.getQueryString());
        return token(form.toSingleValueMap(), authorization);
    }

    @PostMapping(path = "/token", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Exchange a grant for tokens (JSON body)")
    public ResponseEntity<TokenResponse> tokenFromJson(
            @RequestBody Map<String, Object> body,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest request) {
        rejectQueryParameters(request.getQueryString());
        Map<String, String> params = new HashMap<>();
        body.forEach((name, value) -> {
            if (value != null) {
                params.put(name, value.toString());
            }
        });
        return token(params, authorization);
    }

    private ResponseEntity<TokenResponse> token(Map<String, String> params, String authorization) {
        TokenResponse response = tokenService.exchange(params, credentials(params, authorization));
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .header(HttpHeaders.PRAGMA, "no-cache")
                .body(response);
    }

    /**
     * Token parameters, client secrets included, are only read from the request body
     * (RFC 6749 section 2.3.1); a query string would leak them into access logs.
     */
    static void rejectQueryParameters(String queryString) {
        if (queryString != null && !queryString.isBlank()) {
            throw OAuthException.invalidRequest("Token request parameters must be sent in the request body");
        }
    }

    /**
     * Basic credentials win; a body {@code client_id} that disagrees with them is rejected.
     */
    static ClientCredentials credentials(Map<String, String> params, String authorization) {
        String bodyClientId = params.get("client_id");
        if (authorization == null || !authorization.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return new ClientCredentials(bodyClientId, params.get("client_secret"));
        }

        String clientId;
        String clientSecret;
        try {
            String decoded = new String(
                    Base64.getDecoder().decode(authorization.substring(BASIC_PREFIX.length()).trim()),
                    StandardCharsets.UTF_8);
            int separator = decoded.indexOf(':');
            if (separator < 0) {
                throw OAuthException.invalidClient("Malformed Basic authorization header");
            }
            // RFC 6749 section 2.3.1: both parts are form-urlencoded before Basic encoding.
            clientId = URLDecoder.decode(decoded.substring(0, separator), StandardCharsets.UTF_8);
            clientSecret = URLDecoder.decode(decoded.substring(separator + 1), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw OAuthException.invalidClient("Malformed Basic authorization header");
        }
        if (bodyClientId != null && !bodyClientId.equals(clientId)) {
            throw OAuthException.invalidRequest("client_id does not match the Basic authorization header");
        }
        return new ClientCredentials(clientId, clientSecret);
    }
}
