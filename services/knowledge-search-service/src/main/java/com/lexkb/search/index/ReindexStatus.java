package com.lexkb.search.index;

public enum ReindexStatus {
    COMPLETED,
    CANCELLED
}
