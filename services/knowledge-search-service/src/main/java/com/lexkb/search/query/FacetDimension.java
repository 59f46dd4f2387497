package com.lexkb.search.query;

import com.lexkb.search.document.SearchDocument;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public enum FacetDimension {
    TYPE("type"),
    CATEGORIES("categories"),
    TAGS("tags"),
    ACCESS_LEVEL("accessLevel"),
    LANGUAGE("language"),
    AUTHOR("author"),
    DATE("date");

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);

    private final String key;

    FacetDimension(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static FacetDimension from(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        return switch (normalized) {
            case "type", "types", "entitytype" -> TYPE;
            case "category", "categories" -> CATEGORIES;
            case "tag", "tags" -> TAGS;
            case "accesslevel", "access" -> ACCESS_LEVEL;
            case "language", "lang" -> LANGUAGE;
            case "author", "authorid" -> AUTHOR;
            case "date", "month", "createdat" -> DATE;
            default -> null;
        };
    }

    public List<String> valuesOf(SearchDocument document) {
        return switch (this) {
            case TYPE -> List.of(document.getEntityType().key());
            case CATEGORIES -> lower(document.getCategories());
            case TAGS -> lower(document.getTags());
            case ACCESS_LEVEL -> single(document.getAccessLevel());
            case LANGUAGE -> single(primarySubtag(document.getLanguage()));
            case AUTHOR -> single(document.getAuthorId());
            case DATE -> List.of(MONTH.format(document.getCreatedAt()));
        };
    }

    public static String normalizeValue(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String primarySubtag(String language) {
        if (language == null) {
            return null;
        }
        String trimmed = language.trim();
        int separator = trimmed.indexOf('-') >= 0 ? trimmed.indexOf('-') : trimmed.indexOf('_');
        return separator > 0 ? trimmed.substring(0, separator) : trimmed;
    }

    private static List<String> lower(Iterable<String> values) {
        List<String> lowered = new ArrayList<>();
        for (String value : values) {
            String normalized = normalizeValue(value);
            if (!normalized.isEmpty() && !lowered.contains(normalized)) {
                lowered.add(normalized);
            }
        }
        return lowered;
    }

    private static List<String> single(String value) {
        String normalized = normalizeValue(value);
        return normalized.isEmpty() ? List.of() : List.of(normalized);
    }
}
