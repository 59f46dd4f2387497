package com.lexkb.search.ranking;

import com.lexkb.search.document.SearchDocument;
import com.lexkb.search.index.ForwardEntry;

public record ScoredDocument(String docId, double score, ForwardEntry entry) {

    public SearchDocument document() {
        return entry.getDocument();
    }
}
