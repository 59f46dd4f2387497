package com.lexkb.search.index;

import static com.lexkb.search.SearchFixture.doc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.lexkb.search.SearchFixture;
import com.lexkb.search.document.ContentStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IndexRepairServiceTest {

    @Mock
    private ContentStore contentStore;

    @Test
    void repairReindexesFromTheContentStore() {
        SearchFixture fixture = SearchFixture.create(f -> f.contentStore = contentStore);
        corrupt(fixture, "ghost");
        when(contentStore.fetch("ghost")).thenReturn(Optional.of(doc("ghost", "Contract", "restored").build()));

        assertThat(fixture.repairService.repairNow("ghost")).isTrue();

        assertThat(fixture.indexBuilder.current().contains("ghost")).isTrue();
        assertThat(fixture.counter("kb_index_repair_total")).isEqualTo(1.0);
    }

    @Test
    void repairWithoutSnapshotOnlyPurges() {
        SearchFixture fixture = SearchFixture.create();
        corrupt(fixture, "ghost");

        assertThat(fixture.repairService.repairNow("ghost")).isTrue();

        assertThat(fixture.indexBuilder.current().contains("ghost")).isFalse();
        assertThat(fixture.indexBuilder.current().postings("contract")).doesNotContainKey("ghost");
    }

    @Test
    void scheduledRepairsAreDeduplicatedAndDrained() {
        List<Runnable> queued = new ArrayList<>();
        SearchFixture fixture = SearchFixture.create(f -> f.executor = queued::add);
        corrupt(fixture, "ghost");

        fixture.repairService.schedule("ghost");
        fixture.repairService.schedule("ghost");

        assertThat(queued).hasSize(1);
        assertThat(fixture.repairService.pendingDocIds()).containsExactly("ghost");
        assertThat(fixture.repairService.drainPending()).isEqualTo(1);
        assertThat(fixture.repairService.pendingDocIds()).isEmpty();

        queued.forEach(Runnable::run);

        assertThat(fixture.counter("kb_index_repair_total")).isEqualTo(1.0);
    }

    private static void corrupt(SearchFixture fixture, String docId) {
        fixture.index(doc("a", "Contract", "terms").build());
        GenerationDraft draft = GenerationDraft.from(fixture.indexBuilder.current());
        draft.putPosting("contract", docId, new Posting(new int[] {0}));
        fixture.indexBuilder.rollbackTo(draft.build(0L));
    }
}
