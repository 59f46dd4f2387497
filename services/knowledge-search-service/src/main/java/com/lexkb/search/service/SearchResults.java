package com.lexkb.search.service;

import com.lexkb.search.facet.Facets;
import java.util.List;

public record SearchResults(
    List<SearchResult> results,
    int total,
    int page,
    int limit,
    Facets facets,
    List<String> suggestions,
    long tookMs,
    QueryAnalysis queryAnalysis
) {
    public SearchResults {
        results = List.copyOf(results);
        suggestions = List.copyOf(suggestions);
    }
}
