package com.lexkb.search.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Bounded TTL cache with least-recently-used eviction. Reads are lock-free; inserts and evictions
 * share one short critical section.
 */
public class TtlCache<V> {
    private final ConcurrentHashMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final AtomicLong accessTicks = new AtomicLong();
    private final Object evictionLock = new Object();
    private final int maxEntries;
    private final Clock clock;

    public TtlCache(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public Optional<CacheEntry<V>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        entry.touch(accessTicks.incrementAndGet());
        return Optional.of(entry);
    }

    public void put(String key, V value, Duration ttl) {
        put(key, value, 0L, ttl);
    }

    public void put(String key, V value, long generationVersion, Duration ttl) {
        if (key == null || value == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        Instant now = clock.instant();
        CacheEntry<V> entry = new CacheEntry<>(value, generationVersion, now, now.plus(ttl), accessTicks.incrementAndGet());
        synchronized (evictionLock) {
            entries.put(key, entry);
            evictIfNeeded(now);
        }
    }

    /** Like {@link #put}, but keeps a live entry that belongs to a newer generation. */
    public boolean putUnlessNewer(String key, V value, long generationVersion, Duration ttl) {
        if (key == null || value == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        Instant now = clock.instant();
        synchronized (evictionLock) {
            CacheEntry<V> existing = entries.get(key);
            if (existing != null && !existing.isExpired(now) && existing.getGenerationVersion() > generationVersion) {
                return false;
            }
            entries.put(key, new CacheEntry<>(value, generationVersion, now, now.plus(ttl), accessTicks.incrementAndGet()));
            evictIfNeeded(now);
        }
        return true;
    }

    public void remove(String key) {
        if (key != null) {
            entries.remove(key);
        }
    }

    public void remove(String key, CacheEntry<V> entry) {
        if (key != null && entry != null) {
            entries.remove(key, entry);
        }
    }

    public int purgeExpired() {
        Instant now = clock.instant();
        return removeIf(entry -> entry.isExpired(now));
    }

    public int removeIf(Predicate<CacheEntry<V>> predicate) {
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry<V>>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            if (predicate.test(iterator.next().getValue())) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private void evictIfNeeded(Instant now) {
        if (entries.size() <= maxEntries) {
            return;
        }
        entries.values().removeIf(entry -> entry.isExpired(now));
        while (entries.size() > maxEntries) {
            String eldestKey = null;
            long eldestTick = Long.MAX_VALUE;
            for (Map.Entry<String, CacheEntry<V>> candidate : entries.entrySet()) {
                long tick = candidate.getValue().getLastAccessTick();
                if (tick < eldestTick) {
                    eldestTick = tick;
                    eldestKey = candidate.getKey();
                }
            }
            if (eldestKey == null) {
                break;
            }
            entries.remove(eldestKey);
        }
    }
}
