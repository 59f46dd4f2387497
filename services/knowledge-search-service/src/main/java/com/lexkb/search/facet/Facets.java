package com.lexkb.search.facet;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class Facets {
    private static final Facets EMPTY = new Facets(Map.of(), null, null);

    private final Map<String, List<FacetBucket>> dimensions;
    private final Instant earliest;
    private final Instant latest;

    public Facets(Map<String, List<FacetBucket>> dimensions, Instant earliest, Instant latest) {
        Map<String, List<FacetBucket>> copy = new LinkedHashMap<>();
        dimensions.forEach((key, buckets) -> copy.put(key, List.copyOf(buckets)));
        this.dimensions = Collections.unmodifiableMap(copy);
        this.earliest = earliest;
        this.latest = latest;
    }

    public static Facets empty() {
        return EMPTY;
    }

    public List<FacetBucket> get(String dimension) {
        return dimensions.getOrDefault(dimension, List.of());
    }

    public Map<String, Long> counts(String dimension) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (FacetBucket bucket : get(dimension)) {
            counts.put(bucket.value(), bucket.count());
        }
        return counts;
    }

    public Map<String, List<FacetBucket>> asMap() {
        return dimensions;
    }

    public Instant getEarliest() {
        return earliest;
    }

    public Instant getLatest() {
        return latest;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Facets facets)) {
            return false;
        }
        return dimensions.equals(facets.dimensions)
            && Objects.equals(earliest, facets.earliest)
            && Objects.equals(latest, facets.latest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimensions, earliest, latest);
    }
}
