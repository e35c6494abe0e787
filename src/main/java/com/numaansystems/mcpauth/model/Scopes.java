package com.numaansystems.mcpauth.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scope vocabulary of the MCP server and helpers for RFC 6749 space-delimited scope strings.
 *
 * <p>MCP scopes describe what a client may do through the MCP tools; API scopes are the
 * Tableau REST scopes those tools need. The API scopes are only advertised when
 * {@code ADVERTISE_API_SCOPES} is enabled.</p>
 */
public final class Scopes {

    /** Scope granted to service clients and to user logins that request none. */
    public static final String DEFAULT_SCOPE = "read";

    public static final List<String> MCP_SCOPES = List.of(
            "tableau:mcp:content:read",
            "tableau:mcp:datasource:read",
            "tableau:mcp:workbook:read",
            "tableau:mcp:view:read",
            "tableau:mcp:view:download",
            "tableau:mcp:pulse:read",
            "tableau:mcp:insight:create");

    public static final List<String> API_SCOPES = List.of(
            "tableau:content:read",
            "tableau:viz_data_service:read",
            "tableau:views:download",
            "tableau:insight_definitions_metrics:read",
            "tableau:insight_metrics:read",
            "tableau:metric_subscriptions:read",
            "tableau:insights:read",
            "tableau:insight_brief:create");

    private Scopes() {
    }

    public static List<String> supported(boolean includeApiScopes) {
        if (!includeApiScopes) {
            return MCP_SCOPES;
        }
        List<String> all = new ArrayList<>(MCP_SCOPES);
        all.addAll(API_SCOPES);
        return List.copyOf(all);
    }

    /**
     * Splits a space-delimited scope string, dropping blanks and duplicates in order.
     */
    public static List<String> parse(String scope) {
        if (scope == null || scope.isBlank()) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>(Arrays.asList(scope.trim().split("\\s+")));
        return List.copyOf(unique);
    }

    public static String format(Collection<String> scopes) {
        return String.join(" ", scopes);
    }
}
