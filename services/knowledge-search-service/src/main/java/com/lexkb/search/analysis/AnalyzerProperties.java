package com.lexkb.search.analysis;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "knowledge.search.analysis")
public class AnalyzerProperties {
    private String dictionaryPath = "classpath:analysis/legal-dictionary.yml";
    private boolean strict = false;
    private int maxWordLength = 8;
    private List<String> extraStopwords = new ArrayList<>();
    private List<String> extraLegalKeywords = new ArrayList<>();
    private List<String> extraWords = new ArrayList<>();
    private List<List<String>> extraSynonyms = new ArrayList<>();

    public String getDictionaryPath() {
        return dictionaryPath;
    }

    public void setDictionaryPath(String dictionaryPath) {
        this.dictionaryPath = dictionaryPath;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public int getMaxWordLength() {
        return maxWordLength;
    }

    public void setMaxWordLength(int maxWordLength) {
        this.maxWordLength = maxWordLength;
    }

    public List<String> getExtraStopwords() {
        return extraStopwords;
    }

    public void setExtraStopwords(List<String> extraStopwords) {
        this.extraStopwords = extraStopwords;
    }

    public List<String> getExtraLegalKeywords() {
        return extraLegalKeywords;
    }

    public void setExtraLegalKeywords(List<String> extraLegalKeywords) {
        this.extraLegalKeywords = extraLegalKeywords;
    }

    public List<String> getExtraWords() {
        return extraWords;
    }

    public void setExtraWords(List<String> extraWords) {
        this.extraWords = extraWords;
    }

    public List<List<String>> getExtraSynonyms() {
        return extraSynonyms;
    }

    public void setExtraSynonyms(List<List<String>> extraSynonyms) {
        this.extraSynonyms = extraSynonyms;
    }
}
