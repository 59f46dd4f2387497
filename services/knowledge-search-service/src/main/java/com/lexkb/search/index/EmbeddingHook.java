package com.lexkb.search.index;

import java.util.Map;

public interface EmbeddingHook {
    EmbeddingHook NOOP = new EmbeddingHook() {
        @Override
        public void onIndexed(String docId, Map<String, Integer> termVector) {
        }

        @Override
        public void onRemoved(String docId) {
        }
    };

    void onIndexed(String docId, Map<String, Integer> termVector);

    void onRemoved(String docId);
}
