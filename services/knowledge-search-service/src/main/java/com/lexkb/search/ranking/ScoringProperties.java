package com.lexkb.search.ranking;

import com.lexkb.search.analysis.IndexField;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "knowledge.search.scoring")
public class ScoringProperties {
    private double titleWeight = 3.0;
    private double summaryWeight = 2.0;
    private double tagsWeight = 1.5;
    private double categoriesWeight = 1.5;
    private double contentWeight = 1.0;
    private double lengthDamping = 0.3;
    private double phraseBonus = 1.5;
    private double fuzzyWeight = 0.5;

    public double weight(IndexField field) {
        return switch (field) {
            case TITLE -> titleWeight;
            case SUMMARY -> summaryWeight;
            case TAGS -> tagsWeight;
            case CATEGORIES -> categoriesWeight;
            case CONTENT -> contentWeight;
        };
    }

    public double getTitleWeight() {
        return titleWeight;
    }

    public void setTitleWeight(double titleWeight) {
        this.titleWeight = titleWeight;
    }

    public double getSummaryWeight() {
        return summaryWeight;
    }

    public void setSummaryWeight(double summaryWeight) {
        this.summaryWeight = summaryWeight;
    }

    public double getTagsWeight() {
        return tagsWeight;
    }

    public void setTagsWeight(double tagsWeight) {
        this.tagsWeight = tagsWeight;
    }

    public double getCategoriesWeight() {
        return categoriesWeight;
    }

    public void setCategoriesWeight(double categoriesWeight) {
        this.categoriesWeight = categoriesWeight;
    }

    public double getContentWeight() {
        return contentWeight;
    }

    public void setContentWeight(double contentWeight) {
        this.contentWeight = contentWeight;
    }

    public double getLengthDamping() {
        return lengthDamping;
    }

    public void setLengthDamping(double lengthDamping) {
        this.lengthDamping = lengthDamping;
    }

    public double getPhraseBonus() {
        return phraseBonus;
    }

    public void setPhraseBonus(double phraseBonus) {
        this.phraseBonus = phraseBonus;
    }

    public double getFuzzyWeight() {
        return fuzzyWeight;
    }

    public void setFuzzyWeight(double fuzzyWeight) {
        this.fuzzyWeight = fuzzyWeight;
    }
}
