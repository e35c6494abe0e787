package com.numaansystems.mcpauth.service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Which redirect URIs a client may register or use.
 *
 * <ul>
 *   <li>{@code https}: any host</li>
 *   <li>{@code http}: only {@code localhost} and {@code 127.0.0.1}</li>
 *   <li>custom schemes such as {@code cursor:} or {@code vscode:}: allowed, for native apps</li>
 * </ul>
 *
 * Fragments, script-capable schemes and unescaped non-ASCII characters are always rejected.
 */
public final class RedirectUriPolicy {

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1");
    private static final Set<String> FORBIDDEN_SCHEMES = Set.of("javascript", "data", "vbscript", "file");

    private RedirectUriPolicy() {
    }

    public static boolean isAllowed(String redirectUri) {
        if (redirectUri == null || redirectUri.isBlank()) {
            return false;
        }
        URI uri;
        try {
            uri = new URI(redirectUri);
        } catch (URISyntaxException e) {
            return false;
        }
        // Stored URIs are echoed back as-is when codes are appended, so they must already be encoded.
        if (!uri.toASCIIString().equals(redirectUri)) {
            return false;
        }
        if (uri.getScheme() == null || uri.getFragment() != null) {
            return false;
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if ("https".equals(scheme)) {
            return uri.getHost() != null;
        }
        if ("http".equals(scheme)) {
            return uri.getHost() != null && LOOPBACK_HOSTS.contains(uri.getHost().toLowerCase(Locale.ROOT));
        }
        return !FORBIDDEN_SCHEMES.contains(scheme);
    }
}
