package com.numaansystems.mcpauth.store;

import com.numaansystems.mcpauth.model.PendingAuthorization;
import com.numaansystems.mcpauth.util.ExpiringMap;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Authorize requests waiting for the upstream callback, keyed by correlation token.
 */
public class PendingAuthorizationStore {

    private final ExpiringMap<String, PendingAuthorization> entries;

    public PendingAuthorizationStore(Duration ttl, Clock clock) {
        this.entries = new ExpiringMap<>(ttl, clock);
    }

    public void save(String correlationToken, PendingAuthorization pending) {
        entries.put(correlationToken, pending);
    }

    /**
     * Removes and returns the pending authorization. A second call for the same token,
     * or a call after the TTL, returns empty.
     */
    public Optional<PendingAuthorization> consume(String correlationToken) {
        return entries.take(correlationToken);
    }

    public int purgeExpired() {
        return entries.purgeExpired();
    }

    public int size() {
        return entries.size();
    }
}
