package com.numaansystems.mcpauth.store;

import com.numaansystems.mcpauth.model.RefreshTokenData;
import com.numaansystems.mcpauth.util.ExpiringMap;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Server-side state behind opaque refresh tokens. Unlike access tokens these can be
 * revoked: rotation consumes the old token before the new one is saved.
 */
public class RefreshTokenStore {

    private final ExpiringMap<String, RefreshTokenData> entries;

    public RefreshTokenStore(Duration ttl, Clock clock) {
        this.entries = new ExpiringMap<>(ttl, clock);
    }

    public void save(String refreshToken, RefreshTokenData data) {
        entries.put(refreshToken, data);
    }

    public Optional<RefreshTokenData> find(String refreshToken) {
        return entries.get(refreshToken);
    }

    /**
     * Removes and returns the token's data, used for rotation.
     */
    public Optional<RefreshTokenData> consume(String refreshToken) {
        return entries.take(refreshToken);
    }

    public boolean revoke(String refreshToken) {
        return entries.remove(refreshToken);
    }

    public int purgeExpired() {
        return entries.purgeExpired();
    }

    public int size() {
        return entries.size();
    }
}
