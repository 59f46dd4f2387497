package com.lexkb.search.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexkb.search.MutableClock;
import com.lexkb.search.SearchFixture;
import com.lexkb.search.facet.Facets;
import com.lexkb.search.query.QueryParser;
import com.lexkb.search.query.QuerySpec;
import com.lexkb.search.service.QueryAnalysis;
import com.lexkb.search.service.SearchResults;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryResultCacheTest {
    private final MutableClock clock = new MutableClock(SearchFixture.START);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final QueryCacheProperties properties = new QueryCacheProperties();
    private QueryResultCache cache;

    @BeforeEach
    void setUp() {
        properties.setTtlMs(1000);
        cache = new QueryResultCache(properties, new ObjectMapper(), clock, meterRegistry);
    }

    @Test
    void servesEntriesOnlyForTheirGeneration() {
        SearchResults results = results();
        cache.put("k", results, 3L);

        assertThat(cache.get("k", 3L)).containsSame(results);
        assertThat(cache.get("k", 4L)).isEmpty();
        assertThat(cache.size()).isZero();
        assertThat(meterRegistry.counter("kb_search_cache_hit_total").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("kb_search_cache_miss_total").count()).isEqualTo(1.0);
    }

    @Test
    void readersOfAnOlderGenerationLeaveNewerEntriesInPlace() {
        SearchResults newer = results();
        SearchResults older = results();
        cache.put("k", newer, 5L);

        assertThat(cache.get("k", 4L)).isEmpty();
        cache.put("k", older, 4L);

        assertThat(cache.get("k", 5L)).containsSame(newer);
        assertThat(cache.purge(4L)).isZero();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void entriesExpireAfterTheirTtl() {
        cache.put("k", results(), 1L);
        clock.advance(Duration.ofMillis(999));
        assertThat(cache.get("k", 1L)).isPresent();

        clock.advance(Duration.ofMillis(2));
        assertThat(cache.get("k", 1L)).isEmpty();
    }

    @Test
    void purgeDropsExpiredAndStaleEntries() {
        cache.put("old", results(), 1L);
        cache.put("current", results(), 2L);
        clock.advance(Duration.ofMillis(500));
        cache.put("fresh", results(), 2L);
        clock.advance(Duration.ofMillis(600));

        assertThat(cache.purge(2L)).isEqualTo(2);
        assertThat(cache.get("fresh", 2L)).isPresent();
    }

    @Test
    void disabledCacheStoresNothing() {
        properties.setEnabled(false);
        cache.put("k", results(), 1L);

        assertThat(cache.get("k", 1L)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void equivalentQueriesShareAKey() {
        QueryParser parser = SearchFixture.create().queryParser;
        String first = cache.buildKey(parser.parse(QuerySpec.builder()
            .query("  labor   contract ")
            .filter("categories", "Labor", "tax")
            .build()));
        String second = cache.buildKey(parser.parse(QuerySpec.builder()
            .query("labor contract")
            .filter("category", "TAX", "labor")
            .build()));
        String other = cache.buildKey(parser.parse(QuerySpec.builder().query("labor contract").page(2, 10).build()));

        assertThat(first).startsWith("kbq:").isEqualTo(second);
        assertThat(other).isNotEqualTo(first);
    }

    private static SearchResults results() {
        return new SearchResults(List.of(), 0, 1, 10, Facets.empty(), List.of(), 0L, new QueryAnalysis("en", List.of(), List.of(), Map.of()));
    }
}
