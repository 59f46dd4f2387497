package com.lexkb.search.recommend;

import java.util.Locale;

public enum InteractionType {
    VIEW,
    LIKE,
    DOWNLOAD,
    SHARE;

    public static InteractionType from(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "view", "viewed", "read" -> VIEW;
            case "like", "liked", "favorite" -> LIKE;
            case "download", "downloaded" -> DOWNLOAD;
            case "share", "shared" -> SHARE;
            default -> null;
        };
    }
}
