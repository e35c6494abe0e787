package com.numaansystems.mcpauth.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * CORS for browser-based MCP clients (for example the MCP Inspector).
 *
 * <p>Bearer tokens travel in headers, not cookies, so credentials are not allowed and
 * any configured origin pattern may call discovery, registration, token and MCP routes.</p>
 */
@Configuration
public class CorsConfig {

    @Value("${mcp.cors.allowed-origins:*}")
    private List<String> allowedOrigins;

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();

        configuration.setAllowedOriginPatterns(allowedOrigins);
        configuration.setAllowedMethods(Arrays.asList("GET", "POST", "DELETE", "OPTIONS"));
        configuration.setAllowedHeaders(List.of("*"));
        configuration.setAllowCredentials(false);

        // Clients read WWW-Authenticate to discover the authorization server.
        configuration.setExposedHeaders(Arrays.asList("WWW-Authenticate", "Mcp-Session-Id"));

        configuration.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);

        return source;
    }
}
