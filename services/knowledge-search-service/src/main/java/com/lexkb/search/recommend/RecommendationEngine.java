package com.lexkb.search.recommend;

import com.lexkb.search.cache.CacheEntry;
import com.lexkb.search.cache.TtlCache;
import com.lexkb.search.document.SearchDocument;
import com.lexkb.search.index.ForwardEntry;
import com.lexkb.search.index.IndexGeneration;
import com.lexkb.search.query.FacetDimension;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Content-based recommendations. A user's interest profile sums the normalized term vectors and the
 * category/tag keys of documents they interacted with, each weighted by interaction type and decayed
 * by age. Candidates sharing a category or tag with the profile are ranked by cosine similarity.
 * Without usable history the most popular documents are returned instead.
 */
@Service
public class RecommendationEngine {
    private static final Logger log = LoggerFactory.getLogger(RecommendationEngine.class);

    private static final Comparator<Candidate> BY_SIMILARITY = Comparator
        .comparingDouble(Candidate::similarity).reversed()
        .thenComparing(Comparator.comparingLong((Candidate candidate) -> candidate.document().viewCount()).reversed())
        .thenComparing(candidate -> candidate.document().getId());

    private static final Comparator<SearchDocument> BY_POPULARITY = Comparator
        .comparingLong(SearchDocument::viewCount).reversed()
        .thenComparing(Comparator.comparingLong(SearchDocument::likeCount).reversed())
        .thenComparing(SearchDocument::getUpdatedAt, Comparator.reverseOrder())
        .thenComparing(SearchDocument::getId);

    private final InteractionHistoryProvider historyProvider;
    private final RecommendProperties properties;
    private final Clock clock;
    private final TtlCache<UserInterestProfile> profiles;

    public RecommendationEngine(InteractionHistoryProvider historyProvider, RecommendProperties properties, Clock clock) {
        this.historyProvider = historyProvider;
        this.properties = properties;
        this.clock = clock;
        this.profiles = new TtlCache<>(properties.getMaxProfiles(), clock);
    }

    public List<SearchDocument> recommend(IndexGeneration generation, String userId, String currentDocId, int limit) {
        int effectiveLimit = clampLimit(limit);
        UserInterestProfile profile = userId == null ? null : profileFor(generation, userId);
        Set<String> excluded = new HashSet<>();
        if (currentDocId != null) {
            excluded.add(currentDocId);
        }
        if (profile != null) {
            excluded.addAll(profile.interactedDocIds());
        }
        if (profile == null || profile.isEmpty()) {
            log.debug("recommend_fallback user_id={} reason=no_history", userId);
            return popular(generation, userId, excluded, effectiveLimit);
        }

        boolean facetFilter = profile.hasFacetKeys();
        double profileNorm = profile.norm();
        List<Candidate> candidates = new ArrayList<>();
        for (ForwardEntry entry : generation.documents()) {
            SearchDocument document = entry.getDocument();
            if (!eligible(document, userId, excluded)) {
                continue;
            }
            Map<String, Double> vector = vectorOf(entry);
            if (facetFilter && !sharesFacet(profile, vector)) {
                continue;
            }
            double similarity = cosine(profile.weights(), profileNorm, vector);
            if (similarity > 0.0) {
                candidates.add(new Candidate(document, similarity));
            }
        }
        candidates.sort(BY_SIMILARITY);

        List<SearchDocument> recommended = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (recommended.size() >= effectiveLimit) {
                break;
            }
            recommended.add(candidate.document());
            excluded.add(candidate.document().getId());
        }
        if (recommended.size() < effectiveLimit && properties.isFillWithPopular()) {
            recommended.addAll(popular(generation, userId, excluded, effectiveLimit - recommended.size()));
        }
        return recommended;
    }

    /** Builds or reuses the profile; a cached profile is reused only for the same generation and history. */
    public UserInterestProfile profileFor(IndexGeneration generation, String userId) {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofDays(Math.max(1, properties.getHistoryWindowDays())));
        List<InteractionEvent> events = historyProvider.recentInteractions(userId, since);
        String signature = signature(events);
        Optional<UserInterestProfile> cached = profiles.get(userId)
            .map(CacheEntry::getValue)
            .filter(profile -> profile.generationVersion() == generation.getVersion())
            .filter(profile -> profile.historySignature().equals(signature));
        if (cached.isPresent()) {
            return cached.get();
        }
        UserInterestProfile built = buildProfile(generation, userId, events, signature, now);
        profiles.put(userId, built, generation.getVersion(), Duration.ofMillis(properties.getProfileTtlMs()));
        return built;
    }

    public int purgeExpiredProfiles() {
        return profiles.purgeExpired();
    }

    public int cachedProfileCount() {
        return profiles.size();
    }

    private UserInterestProfile buildProfile(
        IndexGeneration generation,
        String userId,
        List<InteractionEvent> events,
        String signature,
        Instant now
    ) {
        Map<String, Double> weights = new HashMap<>();
        Set<String> interacted = new HashSet<>();
        double halfLifeDays = Math.max(0.001, properties.getHalfLifeDays());
        for (InteractionEvent event : events) {
            interacted.add(event.docId());
            ForwardEntry entry = generation.forward(event.docId()).orElse(null);
            if (entry == null) {
                continue;
            }
            double ageDays = Math.max(0.0, Duration.between(event.occurredAt(), now).toMillis() / 86_400_000.0);
            double weight = properties.weight(event.type()) * Math.pow(0.5, ageDays / halfLifeDays);
            if (weight <= 0.0) {
                continue;
            }
            for (Map.Entry<String, Double> component : vectorOf(entry).entrySet()) {
                weights.merge(component.getKey(), component.getValue() * weight, Double::sum);
            }
        }
        return new UserInterestProfile(userId, weights, interacted, generation.getVersion(), signature, now);
    }

    private Map<String, Double> vectorOf(ForwardEntry entry) {
        Map<String, Double> vector = new HashMap<>();
        int length = Math.max(1, entry.getDocLength());
        for (Map.Entry<String, Integer> term : entry.getTermVector().entrySet()) {
            vector.put(term.getKey(), (double) term.getValue() / length);
        }
        SearchDocument document = entry.getDocument();
        for (String category : FacetDimension.CATEGORIES.valuesOf(document)) {
            vector.put(UserInterestProfile.CATEGORY_PREFIX + category, properties.getFacetWeight());
        }
        for (String tag : FacetDimension.TAGS.valuesOf(document)) {
            vector.put(UserInterestProfile.TAG_PREFIX + tag, properties.getFacetWeight());
        }
        return vector;
    }

    private boolean sharesFacet(UserInterestProfile profile, Map<String, Double> vector) {
        for (String key : vector.keySet()) {
            if ((key.startsWith(UserInterestProfile.CATEGORY_PREFIX) || key.startsWith(UserInterestProfile.TAG_PREFIX))
                && profile.weights().containsKey(key)) {
                return true;
            }
        }
        return false;
    }

    private double cosine(Map<String, Double> profile, double profileNorm, Map<String, Double> vector) {
        if (profileNorm == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        double norm = 0.0;
        for (Map.Entry<String, Double> component : vector.entrySet()) {
            double value = component.getValue();
            norm += value * value;
            Double weight = profile.get(component.getKey());
            if (weight != null) {
                dot += weight * value;
            }
        }
        if (norm == 0.0) {
            return 0.0;
        }
        return dot / (profileNorm * Math.sqrt(norm));
    }

    private List<SearchDocument> popular(IndexGeneration generation, String userId, Set<String> excluded, int limit) {
        List<SearchDocument> documents = new ArrayList<>();
        for (ForwardEntry entry : generation.documents()) {
            if (eligible(entry.getDocument(), userId, excluded)) {
                documents.add(entry.getDocument());
            }
        }
        documents.sort(BY_POPULARITY);
        return documents.size() > limit ? new ArrayList<>(documents.subList(0, limit)) : documents;
    }

    private boolean eligible(SearchDocument document, String userId, Set<String> excluded) {
        if (excluded.contains(document.getId())) {
            return false;
        }
        return userId == null || !userId.equals(document.getAuthorId());
    }

    private int clampLimit(int limit) {
        int max = Math.max(1, properties.getMaxLimit());
        if (limit <= 0) {
            return Math.min(Math.max(1, properties.getDefaultLimit()), max);
        }
        return Math.min(limit, max);
    }

    private static String signature(List<InteractionEvent> events) {
        if (events.isEmpty()) {
            return "0";
        }
        InteractionEvent last = events.get(events.size() - 1);
        return events.size() + ":" + last.docId() + ":" + last.occurredAt().toEpochMilli();
    }

    private record Candidate(SearchDocument document, double similarity) {}
}
