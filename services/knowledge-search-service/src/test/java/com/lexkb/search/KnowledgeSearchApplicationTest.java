package com.lexkb.search;

import static org.assertj.core.api.Assertions.assertThat;

import com.lexkb.search.document.EntityType;
import com.lexkb.search.document.SearchDocument;
import com.lexkb.search.index.IndexOptions;
import com.lexkb.search.index.IndexResult;
import com.lexkb.search.query.QuerySpec;
import com.lexkb.search.service.KnowledgeSearchService;
import com.lexkb.search.service.SearchResult;
import com.lexkb.search.service.SearchResults;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "knowledge.search.maintenance.enabled=false")
class KnowledgeSearchApplicationTest {

    @Autowired
    private KnowledgeSearchService searchService;

    @Test
    void indexesAndSearchesThroughTheWiredContext() {
        SearchDocument document = SearchDocument.builder()
            .id("kb-1")
            .entityType(EntityType.ARTICLE)
            .title("劳动合同纠纷处理指南")
            .content("Employees may appeal the labor arbitration ruling in court.")
            .categories(List.of("Labor"))
            .createdAt(Instant.parse("2024-03-01T00:00:00Z"))
            .updatedAt(Instant.parse("2024-03-02T00:00:00Z"))
            .build();

        IndexResult result = searchService.index(document, new IndexOptions(true, true));
        SearchResults byChinese = searchService.search(QuerySpec.of("劳动合同"));
        SearchResults bySynonym = searchService.search(QuerySpec.of("judgment"));

        assertThat(result.success()).isTrue();
        assertThat(byChinese.results()).extracting(SearchResult::docId).containsExactly("kb-1");
        assertThat(bySynonym.results()).extracting(SearchResult::docId).containsExactly("kb-1");
        assertThat(searchService.stats().totalDocuments()).isEqualTo(1);
    }
}
