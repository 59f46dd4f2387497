package com.lexkb.search.document;

import java.util.List;
import java.util.Map;

public record CanonicalFields(
    String title,
    String content,
    String summary,
    List<String> tags,
    List<String> categories,
    Map<String, MetadataValue> metadata
) {
    public CanonicalFields {
        tags = tags == null ? List.of() : List.copyOf(tags);
        categories = categories == null ? List.of() : List.copyOf(categories);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
