package com.lexkb.search.query;

import java.util.Locale;

public enum SortField {
    RELEVANCE,
    DATE,
    UPDATED,
    TITLE,
    VIEWS,
    LIKES;

    public static SortField from(String raw) {
        if (raw == null || raw.isBlank()) {
            return RELEVANCE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "relevance", "score", "_score" -> RELEVANCE;
            case "date", "created", "createdat", "created_at" -> DATE;
            case "updated", "updatedat", "updated_at" -> UPDATED;
            case "title" -> TITLE;
            case "views", "viewcount", "popularity" -> VIEWS;
            case "likes", "likecount" -> LIKES;
            default -> throw new InvalidQueryException("unknown_sort_field", "unknown sort field: " + raw);
        };
    }
}
