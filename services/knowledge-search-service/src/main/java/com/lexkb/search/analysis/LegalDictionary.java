package com.lexkb.search.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class LegalDictionary {
    private final String version;
    private final Set<String> stopwords;
    private final Set<String> legalKeywords;
    private final Set<String> words;
    private final List<Set<String>> synonymGroups;
    private final int maxWordLength;

    public LegalDictionary(
        String version,
        Set<String> stopwords,
        Set<String> legalKeywords,
        Set<String> words,
        List<Set<String>> synonymGroups,
        int maxWordLength
    ) {
        this.version = version;
        this.stopwords = Collections.unmodifiableSet(new LinkedHashSet<>(stopwords));
        this.legalKeywords = Collections.unmodifiableSet(new LinkedHashSet<>(legalKeywords));
        Set<String> allWords = new LinkedHashSet<>(words);
        allWords.addAll(legalKeywords);
        for (String stopword : stopwords) {
            if (stopword.codePointCount(0, stopword.length()) > 1) {
                allWords.add(stopword);
            }
        }
        this.words = Collections.unmodifiableSet(allWords);
        List<Set<String>> groups = new ArrayList<>();
        for (Set<String> group : synonymGroups) {
            if (group != null && group.size() > 1) {
                groups.add(Collections.unmodifiableSet(new LinkedHashSet<>(group)));
            }
        }
        this.synonymGroups = Collections.unmodifiableList(groups);
        this.maxWordLength = Math.max(2, maxWordLength);
    }

    public static LegalDictionary empty() {
        return new LegalDictionary("empty", Set.of(), Set.of(), Set.of(), List.of(), 8);
    }

    public String getVersion() {
        return version;
    }

    public boolean isDroppable(String token) {
        return stopwords.contains(token) && !legalKeywords.contains(token);
    }

    public boolean isLegalKeyword(String token) {
        return legalKeywords.contains(token);
    }

    public boolean isWord(String candidate) {
        return words.contains(candidate);
    }

    public Set<String> getStopwords() {
        return stopwords;
    }

    public Set<String> getLegalKeywords() {
        return legalKeywords;
    }

    public Set<String> getWords() {
        return words;
    }

    public List<Set<String>> getSynonymGroups() {
        return synonymGroups;
    }

    public int getMaxWordLength() {
        return maxWordLength;
    }
}
