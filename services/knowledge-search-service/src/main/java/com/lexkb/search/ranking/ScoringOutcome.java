package com.lexkb.search.ranking;

import com.lexkb.search.query.QueryPlan;
import java.util.List;
import java.util.Set;

public record ScoringOutcome(QueryPlan plan, List<ScoredDocument> matches, Set<String> inconsistentDocIds) {
    public ScoringOutcome {
        matches = List.copyOf(matches);
        inconsistentDocIds = Set.copyOf(inconsistentDocIds);
    }
}
