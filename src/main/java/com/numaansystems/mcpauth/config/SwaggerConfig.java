package com.numaansystems.mcpauth.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI description of the OAuth routes.
 *
 * <h2>Access</h2>
 * <ul>
 *   <li>Swagger UI: /swagger-ui.html</li>
 *   <li>OpenAPI JSON: /v3/api-docs</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI mcpOAuthOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("MCP OAuth Gateway API")
                .description("OAuth 2.1 authorization server for MCP clients, brokering login against Tableau")
                .version("0.1.0")
                .contact(new Contact()
                    .name("Numaan Systems")
                    .email("support@numaansystems.com"))
                .license(new License()
                    .name("MIT License")
                    .url("https://opensource.org/licenses/MIT")));
    }
}
