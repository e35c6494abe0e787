package com.numaansystems.mcpauth.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for UriQueries.
 */
class UriQueriesTest {

    @Test
    @DisplayName("Should percent-encode reserved characters in values")
    void testStrictEncoding() {
        // Arrange
        Map<String, String> params = new LinkedHashMap<>();
        params.put("error_description", "a b&c=d+e/f");
        params.put("state", "vscode://x?y#z");

        // Act
        URI uri = UriQueries.append("https://app.example.com/cb", params);

        // Assert
        String query = uri.getRawQuery();
        assertFalse(query.contains(" "));
        assertTrue(query.startsWith("error_description=a%20b%26c%3Dd%2Be%2Ff&state="));
        assertNull(uri.getRawFragment());
    }

    @Test
    @DisplayName("Should keep an existing query and skip null values")
    void testExistingQuery() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("code", "abc");
        params.put("state", null);

        URI uri = UriQueries.append("cursor://cb?existing=1", params);

        assertEquals("cursor", uri.getScheme());
        assertEquals("existing=1&code=abc", uri.getRawQuery());
    }

    @Test
    @DisplayName("Should return an already encoded redirect URI unchanged")
    void testPreEncodedQuery() {
        // Act
        URI uri = UriQueries.append("https://app.example.com/cb?next=a%20b&path=%2Fhome",
                Map.of("code", "c1"));

        // Assert
        assertEquals("https://app.example.com/cb?next=a%20b&path=%2Fhome&code=c1", uri.toString());
    }
}
