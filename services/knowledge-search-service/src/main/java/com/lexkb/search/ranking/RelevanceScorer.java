package com.lexkb.search.ranking;

import com.lexkb.search.analysis.EditDistance;
import com.lexkb.search.analysis.IndexField;
import com.lexkb.search.index.ForwardEntry;
import com.lexkb.search.index.IndexGeneration;
import com.lexkb.search.index.Posting;
import com.lexkb.search.query.PhraseClause;
import com.lexkb.search.query.QueryClause;
import com.lexkb.search.query.QueryPlan;
import com.lexkb.search.query.QueryProperties;
import com.lexkb.search.query.TermAlternative;
import com.lexkb.search.query.TermClause;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * TF-IDF scoring with field boosts and length normalization:
 *
 * <pre>
 * score(doc) = sum over clauses of clauseScore(doc) / lengthNorm(doc)
 * termScore  = sum over fields of tf(field) * weight(field) * idf(term)
 * idf(term)  = log(1 + N / (1 + df(term)))
 * lengthNorm = 1 + k * (docLength / avgDocLength - 1)
 * </pre>
 *
 * A phrase clause scores its terms' sum multiplied by the phrase bonus, and only for documents
 * where the terms are adjacent. Clauses are conjunctive.
 */
@Component
public class RelevanceScorer {
    private static final int MIN_FUZZY_LENGTH = 3;

    private final ScoringProperties properties;
    private final QueryProperties queryProperties;

    public RelevanceScorer(ScoringProperties properties, QueryProperties queryProperties) {
        ScoringPropertiesValidator.validate(properties);
        this.properties = properties;
        this.queryProperties = queryProperties;
    }

    public ScoringOutcome score(IndexGeneration generation, QueryPlan plan) {
        if (plan.matchNone()) {
            return new ScoringOutcome(plan, List.of(), Set.of());
        }
        if (plan.isBrowse()) {
            List<ScoredDocument> all = new ArrayList<>();
            for (ForwardEntry entry : generation.documents()) {
                all.add(new ScoredDocument(entry.getDocId(), 0.0, entry));
            }
            return new ScoringOutcome(plan, all, Set.of());
        }

        QueryPlan effective = plan.fuzzy() ? expandFuzzy(generation, plan) : plan;
        Set<String> inconsistent = new TreeSet<>();
        Map<String, Double> totals = null;
        for (QueryClause clause : effective.clauses()) {
            Map<String, Double> clauseScores;
            if (clause instanceof PhraseClause phrase) {
                clauseScores = scorePhrase(generation, phrase, inconsistent);
            } else {
                clauseScores = scoreTerm(generation, (TermClause) clause, inconsistent);
            }
            if (totals == null) {
                totals = new HashMap<>(clauseScores);
            } else {
                totals.keySet().retainAll(clauseScores.keySet());
                for (Map.Entry<String, Double> entry : totals.entrySet()) {
                    entry.setValue(entry.getValue() + clauseScores.get(entry.getKey()));
                }
            }
            if (totals.isEmpty()) {
                break;
            }
        }

        List<ScoredDocument> matches = new ArrayList<>();
        if (totals != null) {
            double avgLength = generation.getAvgDocLength();
            for (Map.Entry<String, Double> entry : totals.entrySet()) {
                ForwardEntry forward = generation.forward(entry.getKey()).orElseThrow();
                matches.add(new ScoredDocument(entry.getKey(), entry.getValue() / lengthNorm(forward, avgLength), forward));
            }
        }
        return new ScoringOutcome(effective, matches, inconsistent);
    }

    public double idf(IndexGeneration generation, String term) {
        return Math.log(1.0 + (double) generation.getDocCount() / (1.0 + generation.docFrequency(term)));
    }

    double lengthNorm(ForwardEntry entry, double avgLength) {
        if (avgLength <= 0.0) {
            return 1.0;
        }
        return 1.0 + properties.getLengthDamping() * (entry.getDocLength() / avgLength - 1.0);
    }

    double weightedFrequency(Posting posting) {
        double weighted = 0.0;
        for (IndexField field : IndexField.values()) {
            int frequency = posting.frequencyIn(field);
            if (frequency > 0) {
                weighted += frequency * properties.weight(field);
            }
        }
        return weighted;
    }

    private Map<String, Double> scoreTerm(IndexGeneration generation, TermClause clause, Set<String> inconsistent) {
        Map<String, Double> scores = new HashMap<>();
        for (TermAlternative alternative : clause.alternatives()) {
            Map<String, Posting> postings = generation.postings(alternative.term());
            if (postings.isEmpty()) {
                continue;
            }
            double idf = idf(generation, alternative.term());
            for (Map.Entry<String, Posting> entry : postings.entrySet()) {
                if (!generation.contains(entry.getKey())) {
                    inconsistent.add(entry.getKey());
                    continue;
                }
                double score = alternative.weight() * weightedFrequency(entry.getValue()) * idf;
                scores.merge(entry.getKey(), score, Double::sum);
            }
        }
        return scores;
    }

    private Map<String, Double> scorePhrase(IndexGeneration generation, PhraseClause phrase, Set<String> inconsistent) {
        List<Map<String, Posting>> postings = new ArrayList<>();
        for (String term : phrase.terms()) {
            Map<String, Posting> byDoc = generation.postings(term);
            if (byDoc.isEmpty()) {
                return Map.of();
            }
            postings.add(byDoc);
        }
        Map<String, Double> scores = new HashMap<>();
        for (Map.Entry<String, Posting> first : postings.get(0).entrySet()) {
            String docId = first.getKey();
            List<Posting> docPostings = new ArrayList<>();
            docPostings.add(first.getValue());
            for (int i = 1; i < postings.size(); i++) {
                Posting posting = postings.get(i).get(docId);
                if (posting == null) {
                    break;
                }
                docPostings.add(posting);
            }
            if (docPostings.size() < postings.size()) {
                continue;
            }
            if (!generation.contains(docId)) {
                inconsistent.add(docId);
                continue;
            }
            if (!adjacent(docPostings, phrase.offsets())) {
                continue;
            }
            double sum = 0.0;
            for (int i = 0; i < docPostings.size(); i++) {
                sum += weightedFrequency(docPostings.get(i)) * idf(generation, phrase.terms().get(i));
            }
            scores.put(docId, sum * properties.getPhraseBonus());
        }
        return scores;
    }

    private boolean adjacent(List<Posting> postings, List<Integer> offsets) {
        for (int start : postings.get(0).getPositions()) {
            boolean all = true;
            for (int i = 1; i < postings.size() && all; i++) {
                int expected = start + offsets.get(i);
                all = IndexField.ofPosition(expected) == IndexField.ofPosition(start) && postings.get(i).hasPosition(expected);
            }
            if (all) {
                return true;
            }
        }
        return false;
    }

    private QueryPlan expandFuzzy(IndexGeneration generation, QueryPlan plan) {
        List<QueryClause> expanded = new ArrayList<>();
        boolean changed = false;
        for (QueryClause clause : plan.clauses()) {
            if (clause instanceof TermClause term && hasNoPostings(generation, term)) {
                List<TermAlternative> fuzzy = fuzzyAlternatives(generation, term.primary());
                if (!fuzzy.isEmpty()) {
                    expanded.add(term.withAlternatives(fuzzy));
                    changed = true;
                    continue;
                }
            }
            expanded.add(clause);
        }
        return changed ? plan.withClauses(expanded) : plan;
    }

    private boolean hasNoPostings(IndexGeneration generation, TermClause clause) {
        for (TermAlternative alternative : clause.alternatives()) {
            if (generation.docFrequency(alternative.term()) > 0) {
                return false;
            }
        }
        return true;
    }

    private List<TermAlternative> fuzzyAlternatives(IndexGeneration generation, TermAlternative primary) {
        String term = primary.term();
        if (term.codePointCount(0, term.length()) < MIN_FUZZY_LENGTH) {
            return List.of();
        }
        int maxEdits = Math.max(1, Math.min(2, queryProperties.getFuzzyMaxEdits()));
        List<Candidate> candidates = new ArrayList<>();
        for (String candidate : generation.terms()) {
            int distance = EditDistance.bounded(term, candidate, maxEdits);
            if (distance > 0 && distance <= maxEdits) {
                candidates.add(new Candidate(candidate, distance, generation.docFrequency(candidate)));
            }
        }
        candidates.sort(Comparator.comparingInt(Candidate::distance)
            .thenComparing(Comparator.comparingInt(Candidate::docFrequency).reversed())
            .thenComparing(Candidate::term));
        List<TermAlternative> alternatives = new ArrayList<>();
        int limit = Math.max(1, queryProperties.getFuzzyMaxExpansions());
        for (Candidate candidate : candidates.subList(0, Math.min(limit, candidates.size()))) {
            alternatives.add(new TermAlternative(
                candidate.term(),
                candidate.term(),
                properties.getFuzzyWeight(),
                TermAlternative.Kind.FUZZY
            ));
        }
        return alternatives;
    }

    private record Candidate(String term, int distance, int docFrequency) {}
}
