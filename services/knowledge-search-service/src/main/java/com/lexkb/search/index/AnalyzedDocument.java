package com.lexkb.search.index;

import java.util.Map;

public record AnalyzedDocument(ForwardEntry entry, Map<String, Posting> postings) {
    public AnalyzedDocument {
        postings = Map.copyOf(postings);
    }
}
