package com.lexkb.search.facet;

import com.lexkb.search.document.SearchDocument;
import com.lexkb.search.index.IndexProperties;
import com.lexkb.search.query.FacetDimension;
import com.lexkb.search.query.FilterPredicate;
import com.lexkb.search.ranking.ScoredDocument;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class FacetAggregator {
    private static final Comparator<FacetBucket> BUCKET_ORDER = Comparator
        .comparingLong(FacetBucket::count).reversed()
        .thenComparing(FacetBucket::value);

    private final IndexProperties properties;

    public FacetAggregator(IndexProperties properties) {
        this.properties = properties;
    }

    public Facets aggregate(List<ScoredDocument> matches, FilterPredicate.All filters, List<FacetDimension> dimensions) {
        if (dimensions.isEmpty()) {
            return Facets.empty();
        }
        int bucketLimit = Math.max(1, properties.getFacetBucketLimit());
        Map<String, List<FacetBucket>> result = new LinkedHashMap<>();
        Instant earliest = null;
        Instant latest = null;
        for (FacetDimension dimension : dimensions) {
            FilterPredicate.All others = filters.without(dimension);
            Map<String, Long> counts = new HashMap<>();
            for (ScoredDocument match : matches) {
                SearchDocument document = match.document();
                if (!others.test(document)) {
                    continue;
                }
                for (String value : dimension.valuesOf(document)) {
                    counts.merge(value, 1L, Long::sum);
                }
                if (dimension == FacetDimension.DATE) {
                    Instant created = document.getCreatedAt();
                    earliest = earliest == null || created.isBefore(earliest) ? created : earliest;
                    latest = latest == null || created.isAfter(latest) ? created : latest;
                }
            }
            List<FacetBucket> buckets = new ArrayList<>();
            counts.forEach((value, count) -> buckets.add(new FacetBucket(value, count)));
            buckets.sort(BUCKET_ORDER);
            result.put(dimension.key(), buckets.size() > bucketLimit ? buckets.subList(0, bucketLimit) : buckets);
        }
        return new Facets(result, earliest, latest);
    }
}
