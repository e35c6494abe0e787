package com.numaansystems.mcpauth.util;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe key/value store whose entries expire after a default or per-entry TTL.
 *
 * <p>Expiry is enforced lazily: every read checks the entry's deadline against the
 * injected {@link Clock} and evicts it when it has passed, so no background thread is
 * needed for correctness. {@link #purgeExpired()} may be called periodically to reclaim
 * memory for entries that are never read again.</p>
 *
 * <p>{@link #take(Object)} is an atomic get-and-delete: when several threads race to take
 * the same key, exactly one of them observes the value.</p>
 *
 * @param <K> key type
 * @param <V> value type
 * @author Numaan Systems
 * @version 0.1.0
 */
public class ExpiringMap<K, V> {

    private final ConcurrentHashMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Duration defaultTtl;
    private final Clock clock;

    public ExpiringMap(Duration defaultTtl, Clock clock) {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive: " + defaultTtl);
        }
        this.defaultTtl = defaultTtl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stores a value with the default TTL, replacing any previous entry.
     */
    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    /**
     * Stores a value with an explicit TTL, replacing any previous entry.
     */
    public void put(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        entries.put(key, new Entry<>(value, clock.millis() + ttl.toMillis()));
    }

    /**
     * Returns the live value for the key, evicting it first if it has expired.
     */
    public Optional<V> get(K key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    /**
     * Atomically removes the entry and returns its value if it had not yet expired.
     */
    public Optional<V> take(K key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry<V> entry = entries.remove(key);
        if (entry == null || entry.isExpired(clock.millis())) {
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    public boolean remove(K key) {
        return key != null && entries.remove(key) != null;
    }

    /**
     * Drops every entry whose deadline has passed.
     *
     * @return the number of entries removed
     */
    public int purgeExpired() {
        long now = clock.millis();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        return Math.max(0, before - entries.size());
    }

    /**
     * Number of stored entries, including expired ones not yet evicted.
     */
    public int size() {
        return entries.size();
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    private static final class Entry<V> {
        private final V value;
        private final long expiresAt;

        private Entry(V value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}
