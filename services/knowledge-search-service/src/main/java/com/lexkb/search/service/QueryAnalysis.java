package com.lexkb.search.service;

import java.util.List;
import java.util.Map;

public record QueryAnalysis(
    String language,
    List<String> terms,
    List<String> phrases,
    Map<String, List<String>> legalEntities
) {
    public QueryAnalysis {
        terms = List.copyOf(terms);
        phrases = List.copyOf(phrases);
        legalEntities = Map.copyOf(legalEntities);
    }
}
