package com.lexkb.search.service;

import com.lexkb.search.document.EntityType;
import java.time.Instant;
import java.util.List;
import java.util.Set;

public record SearchResult(
    String docId,
    double score,
    List<String> highlights,
    String entityId,
    EntityType entityType,
    String title,
    String summary,
    Set<String> categories,
    Set<String> tags,
    String authorId,
    String accessLevel,
    Instant createdAt,
    Instant updatedAt,
    long viewCount
) {
    public SearchResult {
        highlights = List.copyOf(highlights);
        categories = Set.copyOf(categories);
        tags = Set.copyOf(tags);
    }
}
