package com.lexkb.search.cache;

import java.time.Instant;

public class CacheEntry<V> {
    private final V value;
    private final long generationVersion;
    private final Instant createdAt;
    private final Instant expiresAt;
    private volatile long lastAccessTick;

    public CacheEntry(V value, long generationVersion, Instant createdAt, Instant expiresAt, long tick) {
        this.value = value;
        this.generationVersion = generationVersion;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.lastAccessTick = tick;
    }

    public V getValue() {
        return value;
    }

    public long getGenerationVersion() {
        return generationVersion;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    long getLastAccessTick() {
        return lastAccessTick;
    }

    void touch(long tick) {
        this.lastAccessTick = tick;
    }
}
