package com.lexkb.search.index;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;

public final class IndexGeneration {
    private static final IndexGeneration EMPTY = new GenerationDraft().build(0L);

    private final long version;
    private final NavigableMap<String, Map<String, Posting>> postings;
    private final Map<String, ForwardEntry> forward;
    private final NavigableMap<String, Integer> surfaceFrequencies;
    private final long totalLength;

    IndexGeneration(
        long version,
        NavigableMap<String, Map<String, Posting>> postings,
        Map<String, ForwardEntry> forward,
        NavigableMap<String, Integer> surfaceFrequencies,
        long totalLength
    ) {
        this.version = version;
        this.postings = postings;
        this.forward = forward;
        this.surfaceFrequencies = surfaceFrequencies;
        this.totalLength = totalLength;
    }

    public static IndexGeneration empty() {
        return EMPTY;
    }

    public long getVersion() {
        return version;
    }

    public int getDocCount() {
        return forward.size();
    }

    public double getAvgDocLength() {
        return forward.isEmpty() ? 0.0 : (double) totalLength / forward.size();
    }

    public boolean contains(String docId) {
        return docId != null && forward.containsKey(docId);
    }

    public Optional<ForwardEntry> forward(String docId) {
        return docId == null ? Optional.empty() : Optional.ofNullable(forward.get(docId));
    }

    public Collection<ForwardEntry> documents() {
        return Collections.unmodifiableCollection(forward.values());
    }

    public Map<String, Posting> postings(String term) {
        Map<String, Posting> byDoc = postings.get(term);
        return byDoc == null ? Map.of() : Collections.unmodifiableMap(byDoc);
    }

    public int docFrequency(String term) {
        Map<String, Posting> byDoc = postings.get(term);
        return byDoc == null ? 0 : byDoc.size();
    }

    public NavigableSet<String> terms() {
        return Collections.unmodifiableNavigableSet(postings.navigableKeySet());
    }

    public NavigableMap<String, Integer> surfaceFrequencies() {
        return Collections.unmodifiableNavigableMap(surfaceFrequencies);
    }

    NavigableMap<String, Map<String, Posting>> rawPostings() {
        return postings;
    }

    Map<String, ForwardEntry> rawForward() {
        return forward;
    }

    NavigableMap<String, Integer> rawSurfaces() {
        return surfaceFrequencies;
    }

    long totalLength() {
        return totalLength;
    }

    @Override
    public String toString() {
        return "IndexGeneration{version=" + version + ", docs=" + forward.size() + ", terms=" + postings.size() + "}";
    }
}
