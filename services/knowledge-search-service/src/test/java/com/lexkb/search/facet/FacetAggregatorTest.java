package com.lexkb.search.facet;

import static com.lexkb.search.SearchFixture.START;
import static com.lexkb.search.SearchFixture.doc;
import static org.assertj.core.api.Assertions.assertThat;

import com.lexkb.search.SearchFixture;
import com.lexkb.search.document.EntityType;
import com.lexkb.search.query.QueryPlan;
import com.lexkb.search.query.QuerySpec;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FacetAggregatorTest {
    private static final Instant MAY = Instant.parse("2024-05-10T08:00:00Z");

    private SearchFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = SearchFixture.create();
        fixture.index(
            doc("1", "Labor guide", "text", "Labor").build(),
            doc("2", "Labor template", "text", "labor").entityType(EntityType.TEMPLATE).build(),
            doc("3", "Lease template", "text", "Property").entityType(EntityType.TEMPLATE).createdAt(MAY).build(),
            doc("4", "Tax memo", "text").accessLevel("internal").build()
        );
    }

    @Test
    void singleValuedDimensionsSumToTheMatchCount() {
        Facets facets = aggregate(QuerySpec.builder().facets("type", "accessLevel", "date").build());

        assertThat(facets.counts("type")).containsExactly(
            Map.entry("article", 2L),
            Map.entry("template", 2L)
        );
        assertThat(facets.counts("accessLevel").values().stream().mapToLong(Long::longValue).sum()).isEqualTo(4L);
        assertThat(facets.counts("date")).containsEntry("2024-06", 3L).containsEntry("2024-05", 1L);
        assertThat(facets.getEarliest()).isEqualTo(MAY);
        assertThat(facets.getLatest()).isEqualTo(START);
    }

    @Test
    void valuesAreCountedCaseInsensitively() {
        Facets facets = aggregate(QuerySpec.builder().facets("categories").build());

        assertThat(facets.counts("categories")).containsExactly(
            Map.entry("labor", 2L),
            Map.entry("property", 1L)
        );
    }

    @Test
    void dimensionIgnoresItsOwnFilterButHonoursOthers() {
        Facets facets = aggregate(QuerySpec.builder()
            .filter("categories", "labor")
            .filter("type", "template")
            .facets("categories", "type")
            .build());

        // categories: only the type filter applies
        assertThat(facets.counts("categories")).containsOnlyKeys("labor", "property");
        assertThat(facets.counts("categories")).containsEntry("labor", 1L).containsEntry("property", 1L);
        // type: only the categories filter applies
        assertThat(facets.counts("type")).containsEntry("article", 1L).containsEntry("template", 1L);
    }

    @Test
    void bucketLimitKeepsTheLargestBuckets() {
        fixture.indexProperties.setFacetBucketLimit(1);

        Facets facets = aggregate(QuerySpec.builder().facets("categories").build());

        assertThat(facets.get("categories")).containsExactly(new FacetBucket("labor", 2L));
    }

    @Test
    void noDimensionsGivesEmptyFacets() {
        assertThat(fixture.facetAggregator.aggregate(List.of(), fixture.queryParser.parse(QuerySpec.of("")).filters(), List.of()))
            .isEqualTo(Facets.empty());
    }

    private Facets aggregate(QuerySpec spec) {
        QueryPlan plan = fixture.queryParser.parse(spec);
        return fixture.facetAggregator.aggregate(
            fixture.scorer.score(fixture.indexBuilder.current(), plan).matches(),
            plan.filters(),
            plan.facets()
        );
    }
}
