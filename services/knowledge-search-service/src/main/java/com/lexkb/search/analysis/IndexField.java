package com.lexkb.search.analysis;

import java.util.EnumSet;
import java.util.Set;

public enum IndexField {
    TITLE,
    SUMMARY,
    TAGS,
    CATEGORIES,
    CONTENT;

    public static final int POSITION_RANGE = 1 << 22;

    public int bit() {
        return 1 << ordinal();
    }

    public int positionBase() {
        return ordinal() * POSITION_RANGE;
    }

    public static IndexField ofPosition(int position) {
        return values()[position / POSITION_RANGE];
    }

    public static Set<IndexField> fromMask(int mask) {
        Set<IndexField> fields = EnumSet.noneOf(IndexField.class);
        for (IndexField field : values()) {
            if ((mask & field.bit()) != 0) {
                fields.add(field);
            }
        }
        return fields;
    }
}
