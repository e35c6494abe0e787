package com.numaansystems.mcpauth.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Authenticated bearer-token caller. Each granted scope becomes a {@code SCOPE_<scope>} authority.
 */
public class McpAuthenticationToken extends AbstractAuthenticationToken {

    private final AuthInfo authInfo;

    public McpAuthenticationToken(AuthInfo authInfo) {
        super(toAuthorities(authInfo.getScopes()));
        this.authInfo = authInfo;
        setAuthenticated(true);
    }

    private static List<GrantedAuthority> toAuthorities(List<String> scopes) {
        return scopes.stream()
                .map(scope -> new SimpleGrantedAuthority("SCOPE_" + scope))
                .collect(Collectors.toList());
    }

    @Override
    public Object getCredentials() {
        return null;
    }

    @Override
    public AuthInfo getPrincipal() {
        return authInfo;
    }

    @Override
    public String getName() {
        return authInfo.getSubject();
    }
}
