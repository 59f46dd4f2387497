package com.lexkb.search;

import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexkb.search.analysis.AnalyzerProperties;
import com.lexkb.search.analysis.LegalDictionary;
import com.lexkb.search.analysis.LegalDictionaryLoader;
import com.lexkb.search.analysis.LegalEntityExtractor;
import com.lexkb.search.analysis.LegalTextAnalyzer;
import com.lexkb.search.cache.QueryCacheProperties;
import com.lexkb.search.cache.QueryResultCache;
import com.lexkb.search.document.ContentStore;
import com.lexkb.search.document.DocumentStoreAdapter;
import com.lexkb.search.document.DocumentStoreProperties;
import com.lexkb.search.document.EntityType;
import com.lexkb.search.document.SearchDocument;
import com.lexkb.search.facet.FacetAggregator;
import com.lexkb.search.index.DocumentAnalyzer;
import com.lexkb.search.index.EmbeddingHook;
import com.lexkb.search.index.IndexBuilder;
import com.lexkb.search.index.IndexOptions;
import com.lexkb.search.index.IndexProperties;
import com.lexkb.search.index.IndexRepairService;
import com.lexkb.search.maintenance.MaintenanceProperties;
import com.lexkb.search.maintenance.MaintenanceScheduler;
import com.lexkb.search.query.QueryParser;
import com.lexkb.search.query.QueryProperties;
import com.lexkb.search.ranking.RelevanceScorer;
import com.lexkb.search.ranking.ScoringProperties;
import com.lexkb.search.recommend.InMemoryInteractionHistory;
import com.lexkb.search.recommend.RecommendProperties;
import com.lexkb.search.recommend.RecommendationEngine;
import com.lexkb.search.service.KnowledgeSearchService;
import com.lexkb.search.suggest.SuggestProperties;
import com.lexkb.search.suggest.SuggestionEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.springframework.beans.factory.ObjectProvider;

public final class SearchFixture {
    public static final Instant START = Instant.parse("2024-06-01T00:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final AnalyzerProperties analyzerProperties = new AnalyzerProperties();
    public final DocumentStoreProperties storeProperties = new DocumentStoreProperties();
    public final IndexProperties indexProperties = new IndexProperties();
    public final QueryProperties queryProperties = new QueryProperties();
    public final ScoringProperties scoringProperties = new ScoringProperties();
    public final QueryCacheProperties cacheProperties = new QueryCacheProperties();
    public final SuggestProperties suggestProperties = new SuggestProperties();
    public final RecommendProperties recommendProperties = new RecommendProperties();
    public final MaintenanceProperties maintenanceProperties = new MaintenanceProperties();
    public Executor executor = Runnable::run;
    public ContentStore contentStore;

    public LegalDictionary dictionary;
    public LegalTextAnalyzer analyzer;
    public LegalEntityExtractor entityExtractor;
    public DocumentStoreAdapter storeAdapter;
    public DocumentAnalyzer documentAnalyzer;
    public IndexBuilder indexBuilder;
    public IndexRepairService repairService;
    public QueryParser queryParser;
    public RelevanceScorer scorer;
    public FacetAggregator facetAggregator;
    public SuggestionEngine suggestionEngine;
    public InMemoryInteractionHistory history;
    public RecommendationEngine recommendationEngine;
    public QueryResultCache queryResultCache;
    public KnowledgeSearchService service;

    private SearchFixture() {
    }

    public static SearchFixture create() {
        return create(fixture -> {
        });
    }

    public static SearchFixture create(Consumer<SearchFixture> customizer) {
        SearchFixture fixture = new SearchFixture();
        fixture.maintenanceProperties.setEnabled(false);
        customizer.accept(fixture);
        fixture.wire();
        return fixture;
    }

    @SuppressWarnings("unchecked")
    private void wire() {
        ObjectProvider<ContentStore> provider = mock(ObjectProvider.class);
        lenient().when(provider.getIfAvailable()).thenAnswer(invocation -> contentStore);

        dictionary = new LegalDictionaryLoader().load(analyzerProperties);
        analyzer = new LegalTextAnalyzer(dictionary);
        entityExtractor = new LegalEntityExtractor(dictionary);
        storeAdapter = new DocumentStoreAdapter(storeProperties, provider, clock);
        documentAnalyzer = new DocumentAnalyzer(analyzer, entityExtractor, storeAdapter, indexProperties);
        indexBuilder = new IndexBuilder(
            documentAnalyzer,
            storeAdapter,
            executor,
            indexProperties,
            EmbeddingHook.NOOP,
            clock,
            meterRegistry
        );
        repairService = new IndexRepairService(indexBuilder, storeAdapter, executor, meterRegistry);
        queryParser = new QueryParser(analyzer, queryProperties);
        scorer = new RelevanceScorer(scoringProperties, queryProperties);
        facetAggregator = new FacetAggregator(indexProperties);
        suggestionEngine = new SuggestionEngine(suggestProperties);
        history = new InMemoryInteractionHistory(recommendProperties.getMaxEventsPerUser());
        recommendationEngine = new RecommendationEngine(history, recommendProperties, clock);
        queryResultCache = new QueryResultCache(cacheProperties, new ObjectMapper(), clock, meterRegistry);
        service = new KnowledgeSearchService(
            indexBuilder,
            repairService,
            storeAdapter,
            queryParser,
            scorer,
            facetAggregator,
            suggestionEngine,
            suggestProperties,
            recommendationEngine,
            queryResultCache,
            entityExtractor,
            meterRegistry
        );
    }

    public MaintenanceScheduler maintenanceScheduler() {
        return new MaintenanceScheduler(
            maintenanceProperties,
            queryResultCache,
            storeAdapter,
            repairService,
            indexBuilder,
            service,
            recommendationEngine,
            clock
        );
    }

    public void index(SearchDocument... documents) {
        for (SearchDocument document : documents) {
            if (!indexBuilder.index(document, IndexOptions.defaults()).success()) {
                throw new IllegalStateException("fixture document failed to index: " + document.getId());
            }
        }
    }

    public static SearchDocument.Builder doc(String id, String title, String content) {
        return SearchDocument.builder()
            .id(id)
            .entityType(EntityType.ARTICLE)
            .title(title)
            .content(content)
            .createdAt(START)
            .updatedAt(START);
    }

    public static SearchDocument.Builder doc(String id, String title, String content, String... categories) {
        return doc(id, title, content).categories(List.of(categories));
    }

    public double counter(String name) {
        return meterRegistry.counter(name).count();
    }
}
