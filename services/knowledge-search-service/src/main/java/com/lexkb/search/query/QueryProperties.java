package com.lexkb.search.query;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "knowledge.search.query")
public class QueryProperties {
    private int defaultLimit = 10;
    private int maxLimit = 100;
    private int defaultMaxResults = 1000;
    private int fuzzyMaxEdits = 1;
    private int fuzzyMaxExpansions = 5;
    private List<List<String>> synonyms = new ArrayList<>();

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getDefaultMaxResults() {
        return defaultMaxResults;
    }

    public void setDefaultMaxResults(int defaultMaxResults) {
        this.defaultMaxResults = defaultMaxResults;
    }

    public int getFuzzyMaxEdits() {
        return fuzzyMaxEdits;
    }

    public void setFuzzyMaxEdits(int fuzzyMaxEdits) {
        this.fuzzyMaxEdits = fuzzyMaxEdits;
    }

    public int getFuzzyMaxExpansions() {
        return fuzzyMaxExpansions;
    }

    public void setFuzzyMaxExpansions(int fuzzyMaxExpansions) {
        this.fuzzyMaxExpansions = fuzzyMaxExpansions;
    }

    public List<List<String>> getSynonyms() {
        return synonyms;
    }

    public void setSynonyms(List<List<String>> synonyms) {
        this.synonyms = synonyms == null ? new ArrayList<>() : synonyms;
    }
}
