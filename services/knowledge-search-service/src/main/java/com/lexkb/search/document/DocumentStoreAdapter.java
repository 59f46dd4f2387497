package com.lexkb.search.document;

import com.lexkb.search.cache.CacheEntry;
import com.lexkb.search.cache.TtlCache;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class DocumentStoreAdapter {
    private static final Logger log = LoggerFactory.getLogger(DocumentStoreAdapter.class);

    private final DocumentStoreProperties properties;
    private final ObjectProvider<ContentStore> contentStoreProvider;
    private final TtlCache<SearchDocument> snapshots;

    public DocumentStoreAdapter(
        DocumentStoreProperties properties,
        ObjectProvider<ContentStore> contentStoreProvider,
        Clock clock
    ) {
        this.properties = properties;
        this.contentStoreProvider = contentStoreProvider;
        this.snapshots = new TtlCache<>(properties.getMaxSnapshots(), clock);
    }

    public Optional<SearchDocument> get(String docId) {
        if (docId == null || docId.isBlank()) {
            return Optional.empty();
        }
        Optional<CacheEntry<SearchDocument>> cached = snapshots.get(docId);
        if (cached.isPresent()) {
            return Optional.of(cached.get().getValue());
        }
        ContentStore store = contentStoreProvider.getIfAvailable();
        if (store == null) {
            return Optional.empty();
        }
        Optional<SearchDocument> fetched = store.fetch(docId);
        fetched.ifPresent(this::remember);
        if (fetched.isEmpty()) {
            log.debug("content store has no document doc_id={}", docId);
        }
        return fetched;
    }

    public void remember(SearchDocument document) {
        if (document == null || document.getId() == null) {
            return;
        }
        snapshots.put(document.getId(), document, Duration.ofMillis(properties.getSnapshotTtlMs()));
    }

    public void evict(String docId) {
        snapshots.remove(docId);
    }

    public boolean hasContentStore() {
        return contentStoreProvider.getIfAvailable() != null;
    }

    public Optional<Iterator<SearchDocument>> streamAll() {
        ContentStore store = contentStoreProvider.getIfAvailable();
        if (store == null) {
            return Optional.empty();
        }
        return Optional.of(store.streamAll());
    }

    public int purgeExpired() {
        return snapshots.purgeExpired();
    }

    public CanonicalFields canonicalFields(SearchDocument document) {
        String summary = trimToNull(document.getSummary());
        return new CanonicalFields(
            trimToEmpty(document.getTitle()),
            trimToEmpty(document.getContent()),
            summary,
            cleanValues(document.getTags()),
            cleanValues(document.getCategories()),
            document.getMetadata()
        );
    }

    private List<String> cleanValues(Set<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> values = new ArrayList<>();
        for (String value : raw) {
            String trimmed = trimToNull(value);
            if (trimmed == null) {
                continue;
            }
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                values.add(trimmed);
            }
        }
        return values;
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
