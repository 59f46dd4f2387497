package com.lexkb.search.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lexkb.search.analysis.IndexField;
import com.lexkb.search.document.SearchDocument;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class GenerationDraftTest {

    @Test
    void derivedDraftNeverMutatesItsSource() {
        GenerationDraft first = new GenerationDraft();
        first.put(analyzed("a", "contract", "labor"));
        IndexGeneration base = first.build(1L);

        GenerationDraft next = GenerationDraft.from(base);
        next.put(analyzed("b", "contract"));
        next.remove("a");
        IndexGeneration derived = next.build(2L);

        assertThat(base.contains("a")).isTrue();
        assertThat(base.postings("contract")).containsOnlyKeys("a");
        assertThat(base.docFrequency("labor")).isEqualTo(1);
        assertThat(derived.contains("a")).isFalse();
        assertThat(derived.postings("contract")).containsOnlyKeys("b");
        assertThat(derived.terms()).doesNotContain("labor");
    }

    @Test
    void putReplacesThePreviousVersionOfADocument() {
        GenerationDraft draft = new GenerationDraft();
        draft.put(analyzed("a", "contract"));
        draft.put(analyzed("a", "tort"));
        IndexGeneration generation = draft.build(1L);

        assertThat(generation.getDocCount()).isEqualTo(1);
        assertThat(generation.docFrequency("contract")).isZero();
        assertThat(generation.docFrequency("tort")).isEqualTo(1);
        assertThat(generation.surfaceFrequencies()).containsOnlyKeys("tort");
    }

    @Test
    void averageLengthTracksAddsAndRemoves() {
        GenerationDraft draft = new GenerationDraft();
        draft.put(analyzed("a", "one"));
        draft.put(analyzed("b", "one", "two", "three"));
        assertThat(draft.build(1L).getAvgDocLength()).isEqualTo(2.0);

        GenerationDraft shrunk = new GenerationDraft();
        shrunk.put(analyzed("a", "one"));
        shrunk.put(analyzed("b", "one", "two", "three"));
        shrunk.remove("b");
        assertThat(shrunk.build(2L).getAvgDocLength()).isEqualTo(1.0);
    }

    @Test
    void purgeDropsPostingsWithoutAForwardEntry() {
        GenerationDraft corrupt = GenerationDraft.from(IndexGeneration.empty());
        corrupt.put(analyzed("a", "contract"));
        corrupt.putPosting("contract", "ghost", new Posting(new int[] {0}));
        corrupt.putPosting("orphan", "ghost", new Posting(new int[] {1}));
        IndexGeneration broken = corrupt.build(1L);

        GenerationDraft repair = GenerationDraft.from(broken);
        assertThat(repair.purgePostings("ghost")).isEqualTo(2);
        IndexGeneration repaired = repair.build(2L);

        assertThat(broken.postings("contract")).containsOnlyKeys("a", "ghost");
        assertThat(repaired.postings("contract")).containsOnlyKeys("a");
        assertThat(repaired.terms()).doesNotContain("orphan");
    }

    @Test
    void draftIsSingleUse() {
        GenerationDraft draft = new GenerationDraft();
        draft.build(1L);

        assertThatThrownBy(() -> draft.put(analyzed("a", "contract"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void postingDerivesFieldFrequenciesFromPositions() {
        Posting posting = new Posting(new int[] {IndexField.CONTENT.positionBase() + 4, 2, IndexField.CONTENT.positionBase()});

        assertThat(posting.getTermFrequency()).isEqualTo(3);
        assertThat(posting.frequencyIn(IndexField.TITLE)).isEqualTo(1);
        assertThat(posting.frequencyIn(IndexField.CONTENT)).isEqualTo(2);
        assertThat(posting.occursIn(IndexField.SUMMARY)).isFalse();
        assertThat(posting.getPositions()).isSorted();
    }

    static AnalyzedDocument analyzed(String docId, String... terms) {
        SearchDocument document = SearchDocument.builder().id(docId).title(String.join(" ", terms)).build();
        Map<String, Posting> postings = new HashMap<>();
        Map<String, Integer> vector = new HashMap<>();
        for (int i = 0; i < terms.length; i++) {
            postings.put(terms[i], new Posting(new int[] {i}));
            vector.put(terms[i], 1);
        }
        ForwardEntry entry = new ForwardEntry(
            document,
            terms.length,
            Map.of(IndexField.TITLE, terms.length),
            vector,
            Set.of(terms)
        );
        return new AnalyzedDocument(entry, postings);
    }
}
