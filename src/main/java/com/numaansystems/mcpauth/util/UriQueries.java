package com.numaansystems.mcpauth.util;

import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Appends query parameters to an absolute URI, percent-encoding every new value strictly.
 * The base URI is taken as already encoded and is returned unchanged.
 */
public final class UriQueries {

    private UriQueries() {
    }

    /**
     * @param uri base URI, any existing query is kept byte for byte
     * @param params parameters in order; null values are skipped
     */
    public static URI append(String uri, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUri(URI.create(uri));
        for (Map.Entry<String, String> param : params.entrySet()) {
            if (param.getValue() == null) {
                continue;
            }
            builder.queryParam(UriUtils.encode(param.getKey(), StandardCharsets.UTF_8),
                    UriUtils.encode(param.getValue(), StandardCharsets.UTF_8));
        }
        return builder.build(true).toUri();
    }
}
