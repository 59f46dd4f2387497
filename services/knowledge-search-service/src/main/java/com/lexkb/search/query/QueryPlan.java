package com.lexkb.search.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record QueryPlan(
    String query,
    String language,
    List<QueryClause> clauses,
    boolean matchNone,
    FilterPredicate.All filters,
    SortField sortField,
    SortOrder sortOrder,
    int page,
    int limit,
    boolean fuzzy,
    double minScore,
    int maxResults,
    List<FacetDimension> facets,
    Map<String, Object> cacheKeyFields
) {
    public QueryPlan {
        clauses = List.copyOf(clauses);
        facets = List.copyOf(facets);
        cacheKeyFields = Collections.unmodifiableMap(new TreeMap<>(cacheKeyFields));
    }

    public boolean isBrowse() {
        return clauses.isEmpty() && !matchNone;
    }

    public QueryPlan withClauses(List<QueryClause> replacement) {
        return new QueryPlan(
            query,
            language,
            replacement,
            matchNone,
            filters,
            sortField,
            sortOrder,
            page,
            limit,
            fuzzy,
            minScore,
            maxResults,
            facets,
            cacheKeyFields
        );
    }

    public List<String> highlightTerms() {
        List<String> surfaces = new ArrayList<>();
        for (QueryClause clause : clauses) {
            if (clause instanceof TermClause term) {
                for (TermAlternative alternative : term.alternatives()) {
                    if (!surfaces.contains(alternative.surface())) {
                        surfaces.add(alternative.surface());
                    }
                }
            } else if (clause instanceof PhraseClause phrase) {
                for (String surface : phrase.surfaces()) {
                    if (!surfaces.contains(surface)) {
                        surfaces.add(surface);
                    }
                }
            }
        }
        return surfaces;
    }
}
