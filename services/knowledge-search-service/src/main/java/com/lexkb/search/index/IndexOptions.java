package com.lexkb.search.index;

public record IndexOptions(boolean generateSummary, boolean extractLegalEntities) {
    private static final IndexOptions DEFAULTS = new IndexOptions(false, false);

    public static IndexOptions defaults() {
        return DEFAULTS;
    }
}
