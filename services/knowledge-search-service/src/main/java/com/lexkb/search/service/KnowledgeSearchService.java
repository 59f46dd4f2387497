package com.lexkb.search.service;

import com.lexkb.search.analysis.Highlighter;
import com.lexkb.search.analysis.LegalEntityExtractor;
import com.lexkb.search.cache.QueryResultCache;
import com.lexkb.search.document.DocumentStoreAdapter;
import com.lexkb.search.document.SearchDocument;
import com.lexkb.search.facet.FacetAggregator;
import com.lexkb.search.facet.Facets;
import com.lexkb.search.index.CancellationToken;
import com.lexkb.search.index.IndexBuilder;
import com.lexkb.search.index.IndexGeneration;
import com.lexkb.search.index.IndexOptions;
import com.lexkb.search.index.IndexRepairService;
import com.lexkb.search.index.IndexResult;
import com.lexkb.search.index.IndexingStats;
import com.lexkb.search.index.ReindexJob;
import com.lexkb.search.query.PhraseClause;
import com.lexkb.search.query.QueryClause;
import com.lexkb.search.query.QueryParser;
import com.lexkb.search.query.QueryPlan;
import com.lexkb.search.query.QuerySpec;
import com.lexkb.search.query.TermClause;
import com.lexkb.search.ranking.RelevanceScorer;
import com.lexkb.search.ranking.ResultOrdering;
import com.lexkb.search.ranking.ScoredDocument;
import com.lexkb.search.ranking.ScoringOutcome;
import com.lexkb.search.recommend.RecommendationEngine;
import com.lexkb.search.suggest.Suggestion;
import com.lexkb.search.suggest.SuggestProperties;
import com.lexkb.search.suggest.SuggestionEngine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class KnowledgeSearchService {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeSearchService.class);
    private static final int FRAGMENT_LENGTH = 150;
    private static final int MAX_FRAGMENTS = 3;

    private final IndexBuilder indexBuilder;
    private final IndexRepairService repairService;
    private final DocumentStoreAdapter storeAdapter;
    private final QueryParser queryParser;
    private final RelevanceScorer relevanceScorer;
    private final FacetAggregator facetAggregator;
    private final SuggestionEngine suggestionEngine;
    private final SuggestProperties suggestProperties;
    private final RecommendationEngine recommendationEngine;
    private final QueryResultCache queryResultCache;
    private final LegalEntityExtractor entityExtractor;
    private final Highlighter highlighter = new Highlighter(FRAGMENT_LENGTH, MAX_FRAGMENTS);
    private final Counter searchCounter;

    public KnowledgeSearchService(
        IndexBuilder indexBuilder,
        IndexRepairService repairService,
        DocumentStoreAdapter storeAdapter,
        QueryParser queryParser,
        RelevanceScorer relevanceScorer,
        FacetAggregator facetAggregator,
        SuggestionEngine suggestionEngine,
        SuggestProperties suggestProperties,
        RecommendationEngine recommendationEngine,
        QueryResultCache queryResultCache,
        LegalEntityExtractor entityExtractor,
        MeterRegistry meterRegistry
    ) {
        this.indexBuilder = indexBuilder;
        this.repairService = repairService;
        this.storeAdapter = storeAdapter;
        this.queryParser = queryParser;
        this.relevanceScorer = relevanceScorer;
        this.facetAggregator = facetAggregator;
        this.suggestionEngine = suggestionEngine;
        this.suggestProperties = suggestProperties;
        this.recommendationEngine = recommendationEngine;
        this.queryResultCache = queryResultCache;
        this.entityExtractor = entityExtractor;
        this.searchCounter = meterRegistry.counter("kb_search_total");
    }

    public IndexResult index(SearchDocument document, IndexOptions options) {
        return indexBuilder.index(document, options);
    }

    public boolean remove(String docId) {
        return indexBuilder.remove(docId);
    }

    public ReindexJob reindexAll(Iterator<SearchDocument> source) {
        return reindexAll(source, new CancellationToken());
    }

    public ReindexJob reindexAll(Iterator<SearchDocument> source, CancellationToken token) {
        return indexBuilder.reindexAll(source, IndexOptions.defaults(), token);
    }

    public Optional<ReindexJob> reindexFromContentStore(CancellationToken token) {
        return storeAdapter.streamAll().map(source -> reindexAll(source, token));
    }

    public SearchResults search(QuerySpec spec) {
        long started = System.nanoTime();
        searchCounter.increment();
        QueryPlan plan = queryParser.parse(spec);
        IndexGeneration generation = indexBuilder.current();
        String cacheKey = queryResultCache.buildKey(plan);
        Optional<SearchResults> cached = queryResultCache.get(cacheKey, generation.getVersion());
        if (cached.isPresent()) {
            return cached.get();
        }

        ScoringOutcome outcome = relevanceScorer.score(generation, plan);
        reportInconsistencies(generation, outcome.inconsistentDocIds());

        List<ScoredDocument> matches = new ArrayList<>();
        for (ScoredDocument match : outcome.matches()) {
            if (match.score() >= plan.minScore()) {
                matches.add(match);
            }
        }
        Facets facets = facetAggregator.aggregate(matches, plan.filters(), plan.facets());

        List<ScoredDocument> filtered = new ArrayList<>();
        for (ScoredDocument match : matches) {
            if (plan.filters().test(match.document())) {
                filtered.add(match);
            }
        }
        List<ScoredDocument> ranked = ResultOrdering.rank(filtered, plan.sortField(), plan.sortOrder(), plan.maxResults());

        List<String> highlightTerms = outcome.plan().highlightTerms();
        List<SearchResult> page = new ArrayList<>();
        int from = (int) Math.min((long) (plan.page() - 1) * plan.limit(), ranked.size());
        int to = Math.min(from + plan.limit(), ranked.size());
        for (ScoredDocument scored : ranked.subList(from, to)) {
            page.add(toResult(scored, highlightTerms));
        }

        SearchResults results = new SearchResults(
            page,
            ranked.size(),
            plan.page(),
            plan.limit(),
            facets,
            searchSuggestions(generation, plan),
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started),
            analyze(outcome.plan())
        );
        queryResultCache.put(cacheKey, results, generation.getVersion());
        return results;
    }

    public List<Suggestion> suggest(String prefix, int limit) {
        return suggestionEngine.suggest(indexBuilder.current(), prefix, limit);
    }

    public List<SearchDocument> recommend(String userId, String currentDocId, int limit) {
        return recommendationEngine.recommend(indexBuilder.current(), userId, currentDocId, limit);
    }

    public IndexingStats stats() {
        return indexBuilder.stats();
    }

    private void reportInconsistencies(IndexGeneration generation, Set<String> docIds) {
        for (String docId : docIds) {
            log.warn("index_inconsistency doc_id={} version={} action=repair_scheduled", docId, generation.getVersion());
            repairService.schedule(docId);
        }
    }

    private SearchResult toResult(ScoredDocument scored, List<String> highlightTerms) {
        SearchDocument document = scored.document();
        List<String> highlights = new ArrayList<>(highlighter.highlight(document.getTitle(), highlightTerms));
        if (highlights.size() < MAX_FRAGMENTS) {
            List<String> body = highlighter.highlight(document.getContent(), highlightTerms);
            highlights.addAll(body.subList(0, Math.min(body.size(), MAX_FRAGMENTS - highlights.size())));
        }
        return new SearchResult(
            scored.docId(),
            scored.score(),
            highlights,
            document.getEntityId(),
            document.getEntityType(),
            document.getTitle(),
            document.getSummary(),
            document.getCategories(),
            document.getTags(),
            document.getAuthorId(),
            document.getAccessLevel(),
            document.getCreatedAt(),
            document.getUpdatedAt(),
            document.viewCount()
        );
    }

    private List<String> searchSuggestions(IndexGeneration generation, QueryPlan plan) {
        String prefix = plan.query().replace("\"", " ").trim();
        if (prefix.isEmpty()) {
            return List.of();
        }
        List<String> texts = new ArrayList<>();
        for (Suggestion suggestion : suggestionEngine.suggest(generation, prefix, suggestProperties.getSearchSuggestions())) {
            texts.add(suggestion.text());
        }
        return texts;
    }

    private QueryAnalysis analyze(QueryPlan plan) {
        List<String> terms = new ArrayList<>();
        List<String> phrases = new ArrayList<>();
        for (QueryClause clause : plan.clauses()) {
            if (clause instanceof PhraseClause phrase) {
                phrases.add(phrase.text());
            } else if (clause instanceof TermClause term) {
                terms.add(term.text());
            }
        }
        return new QueryAnalysis(
            plan.language(),
            terms,
            phrases,
            entityExtractor.group(entityExtractor.extract(plan.query()))
        );
    }
}
