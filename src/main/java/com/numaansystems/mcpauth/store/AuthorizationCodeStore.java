package com.numaansystems.mcpauth.store;

import com.numaansystems.mcpauth.model.AuthorizationCode;
import com.numaansystems.mcpauth.util.ExpiringMap;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Single-use authorization codes issued by the callback and redeemed at the token endpoint.
 */
public class AuthorizationCodeStore {

    private final ExpiringMap<String, AuthorizationCode> entries;

    public AuthorizationCodeStore(Duration ttl, Clock clock) {
        this.entries = new ExpiringMap<>(ttl, clock);
    }

    public void save(String code, AuthorizationCode authorizationCode) {
        entries.put(code, authorizationCode);
    }

    /**
     * Removes and returns the code's data. Concurrent redemptions of one code see at most
     * one value.
     */
    public Optional<AuthorizationCode> consume(String code) {
        return entries.take(code);
    }

    public int purgeExpired() {
        return entries.purgeExpired();
    }

    public int size() {
        return entries.size();
    }
}
