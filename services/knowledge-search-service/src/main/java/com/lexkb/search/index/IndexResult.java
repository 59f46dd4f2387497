package com.lexkb.search.index;

public record IndexResult(boolean success, String docId, long indexTimeMs, String error) {

    public static IndexResult success(String docId, long indexTimeMs) {
        return new IndexResult(true, docId, indexTimeMs, null);
    }

    public static IndexResult failure(String docId, long indexTimeMs, String error) {
        return new IndexResult(false, docId, indexTimeMs, error);
    }
}
