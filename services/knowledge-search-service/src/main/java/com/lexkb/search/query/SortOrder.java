package com.lexkb.search.query;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder from(String raw) {
        if (raw == null || raw.isBlank()) {
            return DESC;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "asc", "ascending" -> ASC;
            case "desc", "descending" -> DESC;
            default -> throw new InvalidQueryException("unknown_sort_order", "unknown sort order: " + raw);
        };
    }
}
