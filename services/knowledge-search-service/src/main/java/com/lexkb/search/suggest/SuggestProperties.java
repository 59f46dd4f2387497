package com.lexkb.search.suggest;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "knowledge.search.suggest")
public class SuggestProperties {
    private int defaultLimit = 10;
    private int maxLimit = 20;
    private int minPrefixMatches = 3;
    private int maxEdits = 2;
    private int searchSuggestions = 5;

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

    public int getMinPrefixMatches() {
        return minPrefixMatches;
    }

    public void setMinPrefixMatches(int minPrefixMatches) {
        this.minPrefixMatches = minPrefixMatches;
    }

    public int getMaxEdits() {
        return maxEdits;
    }

    public void setMaxEdits(int maxEdits) {
        this.maxEdits = maxEdits;
    }

    public int getSearchSuggestions() {
        return searchSuggestions;
    }

    public void setSearchSuggestions(int searchSuggestions) {
        this.searchSuggestions = searchSuggestions;
    }
}
