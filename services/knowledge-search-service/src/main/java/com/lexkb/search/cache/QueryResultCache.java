package com.lexkb.search.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexkb.search.query.QueryPlan;
import com.lexkb.search.service.SearchResults;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class QueryResultCache {
    private static final Logger log = LoggerFactory.getLogger(QueryResultCache.class);

    private final QueryCacheProperties properties;
    private final ObjectMapper objectMapper;
    private final TtlCache<SearchResults> cache;
    private final Counter hits;
    private final Counter misses;

    public QueryResultCache(QueryCacheProperties properties, ObjectMapper objectMapper, Clock clock, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.cache = new TtlCache<>(properties.getMaxEntries(), clock);
        this.hits = meterRegistry.counter("kb_search_cache_hit_total");
        this.misses = meterRegistry.counter("kb_search_cache_miss_total");
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public Optional<SearchResults> get(String key, long currentVersion) {
        if (!properties.isEnabled() || key == null) {
            return Optional.empty();
        }
        Optional<CacheEntry<SearchResults>> entry = cache.get(key);
        if (entry.isPresent() && entry.get().getGenerationVersion() == currentVersion) {
            hits.increment();
            return Optional.of(entry.get().getValue());
        }
        boolean stale = entry.isPresent() && entry.get().getGenerationVersion() < currentVersion;
        if (stale) {
            cache.remove(key, entry.get());
        }
        misses.increment();
        log.debug("query_cache_miss key={} version={} stale={}", key, currentVersion, stale);
        return Optional.empty();
    }

    public void put(String key, SearchResults results, long generationVersion) {
        if (!properties.isEnabled() || key == null || results == null) {
            return;
        }
        if (!cache.putUnlessNewer(key, results, generationVersion, Duration.ofMillis(properties.getTtlMs()))) {
            log.debug("query_cache_put_skipped key={} version={} reason=newer_entry", key, generationVersion);
        }
    }

    public String buildKey(QueryPlan plan) {
        if (plan == null) {
            return null;
        }
        String hash = CacheKeyUtil.hashJson(objectMapper, plan.cacheKeyFields());
        if (hash == null) {
            return null;
        }
        return properties.getKeyPrefix() + hash;
    }

    public int purge(long currentVersion) {
        int expired = cache.purgeExpired();
        int stale = cache.removeIf(entry -> entry.getGenerationVersion() < currentVersion);
        return expired + stale;
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }
}
