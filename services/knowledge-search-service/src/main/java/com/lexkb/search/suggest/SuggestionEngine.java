package com.lexkb.search.suggest;

import com.lexkb.search.analysis.EditDistance;
import com.lexkb.search.index.ForwardEntry;
import com.lexkb.search.index.IndexGeneration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import org.springframework.stereotype.Service;

@Service
public class SuggestionEngine {
    private static final double TITLE_PREFIX_SCORE = 1.0;
    private static final double TITLE_CONTAINS_SCORE = 0.7;
    private static final double FUZZY_PENALTY = 0.5;

    private final SuggestProperties properties;

    public SuggestionEngine(SuggestProperties properties) {
        this.properties = properties;
    }

    public List<Suggestion> suggest(IndexGeneration generation, String prefix, int limit) {
        String normalized = prefix == null ? "" : prefix.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || generation.getDocCount() == 0) {
            return List.of();
        }
        int effectiveLimit = clampLimit(limit);
        double docCount = generation.getDocCount();

        List<Suggestion> candidates = new ArrayList<>();
        NavigableMap<String, Integer> dictionary = generation.surfaceFrequencies();
        NavigableMap<String, Integer> prefixed = dictionary.subMap(normalized, true, normalized + Character.MAX_VALUE, false);
        for (Map.Entry<String, Integer> entry : prefixed.entrySet()) {
            candidates.add(new Suggestion(entry.getKey(), entry.getValue() / docCount, SuggestionType.TERM));
        }
        if (prefixed.size() < properties.getMinPrefixMatches()) {
            candidates.addAll(fuzzyMatches(dictionary, normalized, docCount));
        }
        for (ForwardEntry entry : generation.documents()) {
            String title = entry.getDocument().getTitle();
            if (title == null || title.isBlank()) {
                continue;
            }
            String lower = title.toLowerCase(Locale.ROOT);
            if (lower.startsWith(normalized)) {
                candidates.add(new Suggestion(title, TITLE_PREFIX_SCORE, SuggestionType.TITLE));
            } else if (lower.contains(normalized)) {
                candidates.add(new Suggestion(title, TITLE_CONTAINS_SCORE, SuggestionType.TITLE));
            }
        }
        return dedupe(candidates, effectiveLimit);
    }

    private List<Suggestion> fuzzyMatches(NavigableMap<String, Integer> dictionary, String prefix, double docCount) {
        int maxEdits = Math.max(0, Math.min(2, properties.getMaxEdits()));
        int prefixLength = prefix.codePointCount(0, prefix.length());
        if (maxEdits == 0 || prefixLength <= maxEdits) {
            return List.of();
        }
        List<Suggestion> fuzzy = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : dictionary.entrySet()) {
            String term = entry.getKey();
            if (term.startsWith(prefix)) {
                continue;
            }
            int termLength = term.codePointCount(0, term.length());
            String head = term.substring(0, term.offsetByCodePoints(0, Math.min(termLength, prefixLength)));
            int distance = EditDistance.bounded(prefix, head, maxEdits);
            if (distance <= maxEdits) {
                double closeness = 1.0 - (double) distance / (maxEdits + 1);
                fuzzy.add(new Suggestion(term, entry.getValue() / docCount * closeness * FUZZY_PENALTY, SuggestionType.FUZZY));
            }
        }
        return fuzzy;
    }

    private List<Suggestion> dedupe(List<Suggestion> candidates, int limit) {
        Map<String, Suggestion> best = new LinkedHashMap<>();
        for (Suggestion candidate : candidates) {
            String key = candidate.text().toLowerCase(Locale.ROOT);
            Suggestion existing = best.get(key);
            if (existing == null || candidate.score() > existing.score()) {
                best.put(key, candidate);
            }
        }
        List<Suggestion> ranked = new ArrayList<>(best.values());
        ranked.sort(Comparator.comparingDouble(Suggestion::score).reversed().thenComparing(Suggestion::text));
        return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : List.copyOf(ranked);
    }

    private int clampLimit(int limit) {
        int max = Math.max(1, properties.getMaxLimit());
        if (limit <= 0) {
            return Math.min(Math.max(1, properties.getDefaultLimit()), max);
        }
        return Math.min(limit, max);
    }
}
