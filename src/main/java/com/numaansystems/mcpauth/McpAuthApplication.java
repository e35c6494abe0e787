package com.numaansystems.mcpauth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * MCP OAuth Gateway Application
 *
 * <p>OAuth 2.1 authorization server that lets MCP clients call the Tableau MCP server
 * without the server ever holding user credentials. Login is brokered to Tableau with a
 * PKCE authorization-code flow; this server then issues its own encrypted bearer tokens.</p>
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>Unauthenticated MCP request gets {@code 401} with a {@code WWW-Authenticate} header</li>
 *   <li>Client reads protected-resource and authorization-server metadata</li>
 *   <li>Client registers at /oauth/register, or uses a pre-provisioned id and secret</li>
 *   <li>/oauth/authorize redirects the user to Tableau</li>
 *   <li>Tableau redirects back to /Callback; a single-use code goes to the client</li>
 *   <li>/oauth/token exchanges the code for an encrypted access token and a refresh token</li>
 *   <li>The bearer middleware decrypts the token on every MCP request</li>
 * </ol>
 *
 * <h2>State</h2>
 * <p>Pending authorizations, codes, refresh tokens and registered clients are held in
 * memory with TTLs. Access tokens are not stored: they are JWEs only this process can read.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@SpringBootApplication
public class McpAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(McpAuthApplication.class, args);
    }
}
