package com.lexkb.search.index;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Mutable staging area for the next generation. A draft derived from a published generation copies
 * only the outer maps up front; a term's doc map is copied the first time the draft touches it, so
 * the source generation is never mutated.
 */
public final class GenerationDraft {
    private final NavigableMap<String, Map<String, Posting>> postings;
    private final Map<String, ForwardEntry> forward;
    private final NavigableMap<String, Integer> surfaces;
    private final Set<String> ownedTerms;
    private final boolean copyOnWrite;
    private long totalLength;
    private boolean built;

    public GenerationDraft() {
        this.postings = new TreeMap<>();
        this.forward = new HashMap<>();
        this.surfaces = new TreeMap<>();
        this.ownedTerms = new HashSet<>();
        this.copyOnWrite = false;
    }

    private GenerationDraft(IndexGeneration base) {
        this.postings = new TreeMap<>(base.rawPostings());
        this.forward = new HashMap<>(base.rawForward());
        this.surfaces = new TreeMap<>(base.rawSurfaces());
        this.ownedTerms = new HashSet<>();
        this.copyOnWrite = true;
        this.totalLength = base.totalLength();
    }

    public static GenerationDraft from(IndexGeneration base) {
        return new GenerationDraft(base);
    }

    /** Replaces whatever the draft holds for the document with the analyzed version. */
    public void put(AnalyzedDocument analyzed) {
        ensureOpen();
        String docId = analyzed.entry().getDocId();
        remove(docId);
        for (Map.Entry<String, Posting> entry : analyzed.postings().entrySet()) {
            writableDocs(entry.getKey()).put(docId, entry.getValue());
        }
        forward.put(docId, analyzed.entry());
        totalLength += analyzed.entry().getDocLength();
        for (String surface : analyzed.entry().getSurfaces()) {
            surfaces.merge(surface, 1, Integer::sum);
        }
    }

    /** Removes the document through its forward entry. Returns false when the draft has no entry. */
    public boolean remove(String docId) {
        ensureOpen();
        ForwardEntry previous = forward.remove(docId);
        if (previous == null) {
            return false;
        }
        totalLength -= previous.getDocLength();
        for (String term : previous.getTermVector().keySet()) {
            removePosting(term, docId);
        }
        for (String surface : previous.getSurfaces()) {
            surfaces.computeIfPresent(surface, (key, count) -> count <= 1 ? null : count - 1);
        }
        return true;
    }

    /**
     * Drops postings that reference {@code docId} without trusting the forward index. Scans every
     * term, so it is reserved for repairing inconsistent generations. Returns the number of postings
     * removed.
     */
    public int purgePostings(String docId) {
        ensureOpen();
        int removed = 0;
        Iterator<Map.Entry<String, Map<String, Posting>>> terms = postings.entrySet().iterator();
        while (terms.hasNext()) {
            Map.Entry<String, Map<String, Posting>> term = terms.next();
            if (!term.getValue().containsKey(docId)) {
                continue;
            }
            Map<String, Posting> docs = term.getValue();
            if (copyOnWrite && ownedTerms.add(term.getKey())) {
                docs = new HashMap<>(docs);
                term.setValue(docs);
            }
            docs.remove(docId);
            removed++;
            if (docs.isEmpty()) {
                terms.remove();
                ownedTerms.remove(term.getKey());
            }
        }
        return removed;
    }

    /** Low-level posting write used when replaying raw postings; does not touch the forward index. */
    public void putPosting(String term, String docId, Posting posting) {
        ensureOpen();
        writableDocs(term).put(docId, posting);
    }

    public boolean contains(String docId) {
        return forward.containsKey(docId);
    }

    public int size() {
        return forward.size();
    }

    public IndexGeneration build(long version) {
        ensureOpen();
        built = true;
        return new IndexGeneration(version, postings, forward, surfaces, totalLength);
    }

    private Map<String, Posting> writableDocs(String term) {
        Map<String, Posting> docs = postings.get(term);
        if (docs == null) {
            docs = new HashMap<>();
            postings.put(term, docs);
            ownedTerms.add(term);
            return docs;
        }
        if (copyOnWrite && ownedTerms.add(term)) {
            docs = new HashMap<>(docs);
            postings.put(term, docs);
        }
        return docs;
    }

    private void removePosting(String term, String docId) {
        Map<String, Posting> docs = postings.get(term);
        if (docs == null || !docs.containsKey(docId)) {
            return;
        }
        if (docs.size() == 1) {
            postings.remove(term);
            ownedTerms.remove(term);
            return;
        }
        writableDocs(term).remove(docId);
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("generation draft already built");
        }
    }
}
