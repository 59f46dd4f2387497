package com.lexkb.search.index;

import com.lexkb.search.analysis.IndexField;
import com.lexkb.search.document.SearchDocument;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

public final class ForwardEntry {
    private final SearchDocument document;
    private final int docLength;
    private final Map<IndexField, Integer> fieldLengths;
    private final Map<String, Integer> termVector;
    private final Set<String> surfaces;

    public ForwardEntry(
        SearchDocument document,
        int docLength,
        Map<IndexField, Integer> fieldLengths,
        Map<String, Integer> termVector,
        Set<String> surfaces
    ) {
        this.document = document;
        this.docLength = docLength;
        this.fieldLengths = Collections.unmodifiableMap(
            fieldLengths == null || fieldLengths.isEmpty() ? new EnumMap<>(IndexField.class) : new EnumMap<>(fieldLengths)
        );
        this.termVector = Collections.unmodifiableMap(termVector == null ? Map.of() : new HashMap<>(termVector));
        this.surfaces = Collections.unmodifiableSet(surfaces == null ? Set.of() : new HashSet<>(surfaces));
    }

    public String getDocId() {
        return document.getId();
    }

    public SearchDocument getDocument() {
        return document;
    }

    public int getDocLength() {
        return docLength;
    }

    public int fieldLength(IndexField field) {
        return fieldLengths.getOrDefault(field, 0);
    }

    public Map<IndexField, Integer> getFieldLengths() {
        return fieldLengths;
    }

    public Map<String, Integer> getTermVector() {
        return termVector;
    }

    public Set<String> getSurfaces() {
        return surfaces;
    }
}
