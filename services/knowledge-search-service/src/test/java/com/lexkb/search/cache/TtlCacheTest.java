package com.lexkb.search.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.lexkb.search.MutableClock;
import com.lexkb.search.SearchFixture;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class TtlCacheTest {
    private final MutableClock clock = new MutableClock(SearchFixture.START);

    @Test
    void evictsTheLeastRecentlyUsedEntry() {
        TtlCache<String> cache = new TtlCache<>(2, clock);
        cache.put("a", "A", Duration.ofMinutes(1));
        cache.put("b", "B", Duration.ofMinutes(1));
        cache.get("a");

        cache.put("c", "C", Duration.ofMinutes(1));

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).isPresent();
        assertThat(cache.get("c")).isPresent();
    }

    @Test
    void expiredEntriesMakeRoomBeforeLiveOnes() {
        TtlCache<String> cache = new TtlCache<>(2, clock);
        cache.put("short", "S", Duration.ofSeconds(1));
        cache.put("long", "L", Duration.ofMinutes(1));
        cache.get("short");
        clock.advance(Duration.ofSeconds(2));

        cache.put("next", "N", Duration.ofMinutes(1));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("long")).isPresent();
    }

    @Test
    void ignoresNonPositiveTtl() {
        TtlCache<String> cache = new TtlCache<>(2, clock);
        cache.put("k", "V", Duration.ZERO);

        assertThat(cache.size()).isZero();
    }
}
