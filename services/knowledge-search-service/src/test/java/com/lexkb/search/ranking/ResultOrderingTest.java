package com.lexkb.search.ranking;

import static com.lexkb.search.SearchFixture.START;
import static com.lexkb.search.SearchFixture.doc;
import static org.assertj.core.api.Assertions.assertThat;

import com.lexkb.search.document.SearchDocument;
import com.lexkb.search.index.ForwardEntry;
import com.lexkb.search.query.SortField;
import com.lexkb.search.query.SortOrder;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResultOrderingTest {

    @Test
    void equalScoresFallBackToRecencyThenId() {
        ScoredDocument older = scored(doc("a", "A", "x").updatedAt(START).build(), 1.0);
        ScoredDocument newerB = scored(doc("b", "B", "x").updatedAt(START.plus(Duration.ofDays(1))).build(), 1.0);
        ScoredDocument newerC = scored(doc("c", "C", "x").updatedAt(START.plus(Duration.ofDays(1))).build(), 1.0);
        ScoredDocument best = scored(doc("d", "D", "x").build(), 2.0);

        List<ScoredDocument> ranked = ResultOrdering.rank(List.of(older, newerC, best, newerB), SortField.RELEVANCE, SortOrder.DESC, 0);

        assertThat(ranked).extracting(ScoredDocument::docId).containsExactly("d", "b", "c", "a");
    }

    @Test
    void titleSortIgnoresCase() {
        ScoredDocument upper = scored(doc("1", "Beta", "x").build(), 0.0);
        ScoredDocument lower = scored(doc("2", "alpha", "x").build(), 0.0);

        assertThat(ResultOrdering.rank(List.of(upper, lower), SortField.TITLE, SortOrder.ASC, 0))
            .extracting(ScoredDocument::docId)
            .containsExactly("2", "1");
    }

    @Test
    void popularitySortReadsViewCountMetadata() {
        ScoredDocument quiet = scored(doc("q", "Q", "x").metadata("viewCount", 3).build(), 0.0);
        ScoredDocument busy = scored(doc("b", "B", "x").metadata("viewCount", 40).build(), 0.0);
        ScoredDocument unset = scored(doc("u", "U", "x").build(), 0.0);

        assertThat(ResultOrdering.rank(List.of(quiet, unset, busy), SortField.VIEWS, SortOrder.DESC, 0))
            .extracting(ScoredDocument::docId)
            .containsExactly("b", "q", "u");
    }

    @Test
    void maxResultsTruncatesAfterSorting() {
        List<ScoredDocument> documents = List.of(
            scored(doc("1", "One", "x").build(), 0.1),
            scored(doc("2", "Two", "x").build(), 0.9),
            scored(doc("3", "Three", "x").build(), 0.5)
        );

        assertThat(ResultOrdering.rank(documents, SortField.RELEVANCE, SortOrder.DESC, 2))
            .extracting(ScoredDocument::docId)
            .containsExactly("2", "3");
    }

    private static ScoredDocument scored(SearchDocument document, double score) {
        return new ScoredDocument(document.getId(), score, new ForwardEntry(document, 1, null, null, null));
    }
}
