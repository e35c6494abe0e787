package com.numaansystems.mcpauth.controller;

import com.numaansystems.mcpauth.service.OAuthException;
import com.numaansystems.mcpauth.service.OAuthRedirectException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders OAuth failures in the RFC 6749 shape.
 *
 * <ul>
 *   <li>{@link OAuthException}: JSON {@code {error, error_description}} with its status</li>
 *   <li>{@link OAuthRedirectException}: {@code 302} to the client's redirect URI</li>
 *   <li>anything else: {@code server_error} without internal detail</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestControllerAdvice(assignableTypes = {
        AuthorizationController.class, RegistrationController.class, TokenController.class})
public class OAuthExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(OAuthExceptionHandler.class);

    @ExceptionHandler(OAuthException.class)
    public ResponseEntity<Map<String, String>> handleOAuthException(OAuthException e) {
        logger.debug("OAuth error {}: {}", e.getError(), e.getDescription());
        ResponseEntity.BodyBuilder response = ResponseEntity.status(e.getStatus())
                .cacheControl(CacheControl.noStore());
        if (e.getStatus() == HttpStatus.UNAUTHORIZED && OAuth2ErrorCodes.INVALID_CLIENT.equals(e.getError())) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"oauth\"");
        }
        return response.body(body(e.getError(), e.getDescription()));
    }

    @ExceptionHandler(OAuthRedirectException.class)
    public ResponseEntity<Void> handleOAuthRedirect(OAuthRedirectException e) {
        logger.info("Redirecting OAuth error {} to client: {}", e.getError(), e.getDescription());
        return AuthorizationController.redirect(e.toLocation());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.debug("Unreadable OAuth request body: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .cacheControl(CacheControl.noStore())
                .body(body(OAuth2ErrorCodes.INVALID_REQUEST, "Request body is not valid"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            HttpStatusCode status = errorResponse.getStatusCode();
            logger.debug("Malformed OAuth request: {}", e.getMessage());
            return ResponseEntity.status(status)
                    .cacheControl(CacheControl.noStore())
                    .body(body(OAuth2ErrorCodes.INVALID_REQUEST, "Malformed request"));
        }
        logger.error("Unexpected error handling OAuth request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .cacheControl(CacheControl.noStore())
                .body(body(OAuth2ErrorCodes.SERVER_ERROR, "Internal server error"));
    }

    private static Map<String, String> body(String error, String description) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("error_description", description);
        return body;
    }
}
