package com.lexkb.search.document;

import java.util.Locale;

public enum EntityType {
    ARTICLE,
    DOCUMENT,
    TEMPLATE,
    CASE,
    USER;

    public static EntityType from(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "article", "knowledge_article" -> ARTICLE;
            case "document", "doc" -> DOCUMENT;
            case "template" -> TEMPLATE;
            case "case" -> CASE;
            case "user" -> USER;
            default -> null;
        };
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
