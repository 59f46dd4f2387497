package com.lexkb.search.recommend;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

public record UserInterestProfile(
    String userId,
    Map<String, Double> weights,
    Set<String> interactedDocIds,
    long generationVersion,
    String historySignature,
    Instant builtAt
) {
    public static final String CATEGORY_PREFIX = "category:";
    public static final String TAG_PREFIX = "tag:";

    public UserInterestProfile {
        weights = Map.copyOf(weights);
        interactedDocIds = Set.copyOf(interactedDocIds);
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public double norm() {
        double sum = 0.0;
        for (double weight : weights.values()) {
            sum += weight * weight;
        }
        return Math.sqrt(sum);
    }

    public boolean hasFacetKeys() {
        for (String key : weights.keySet()) {
            if (key.startsWith(CATEGORY_PREFIX) || key.startsWith(TAG_PREFIX)) {
                return true;
            }
        }
        return false;
    }
}
