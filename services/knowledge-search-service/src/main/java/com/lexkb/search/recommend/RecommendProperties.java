package com.lexkb.search.recommend;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "knowledge.search.recommend")
public class RecommendProperties {
    private int historyWindowDays = 90;
    private double halfLifeDays = 14.0;
    private int maxEventsPerUser = 200;
    private double viewWeight = 1.0;
    private double likeWeight = 2.0;
    private double downloadWeight = 1.5;
    private double shareWeight = 1.5;
    private double facetWeight = 1.0;
    private boolean fillWithPopular = true;
    private int defaultLimit = 5;
    private int maxLimit = 50;
    private long profileTtlMs = 300000;
    private int maxProfiles = 10000;

    public int getHistoryWindowDays() {
        return historyWindowDays;
    }

    public void setHistoryWindowDays(int historyWindowDays) {
        this.historyWindowDays = historyWindowDays;
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public void setHalfLifeDays(double halfLifeDays) {
        this.halfLifeDays = halfLifeDays;
    }

    public int getMaxEventsPerUser() {
        return maxEventsPerUser;
    }

    public void setMaxEventsPerUser(int maxEventsPerUser) {
        this.maxEventsPerUser = maxEventsPerUser;
    }

    public double getViewWeight() {
        return viewWeight;
    }

    public void setViewWeight(double viewWeight) {
        this.viewWeight = viewWeight;
    }

    public double getLikeWeight() {
        return likeWeight;
    }

    public void setLikeWeight(double likeWeight) {
        this.likeWeight = likeWeight;
    }

    public double getDownloadWeight() {
        return downloadWeight;
    }

    public void setDownloadWeight(double downloadWeight) {
        this.downloadWeight = downloadWeight;
    }

    public double getShareWeight() {
        return shareWeight;
    }

    public void setShareWeight(double shareWeight) {
        this.shareWeight = shareWeight;
    }

    public double getFacetWeight() {
        return facetWeight;
    }

    public void setFacetWeight(double facetWeight) {
        this.facetWeight = facetWeight;
    }

    public boolean isFillWithPopular() {
        return fillWithPopular;
    }

    public void setFillWithPopular(boolean fillWithPopular) {
        this.fillWithPopular = fillWithPopular;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public long getProfileTtlMs() {
        return profileTtlMs;
    }

    public void setProfileTtlMs(long profileTtlMs) {
        this.profileTtlMs = profileTtlMs;
    }

    public int getMaxProfiles() {
        return maxProfiles;
    }

    public void setMaxProfiles(int maxProfiles) {
        this.maxProfiles = maxProfiles;
    }

    public double weight(InteractionType type) {
        return switch (type) {
            case VIEW -> viewWeight;
            case LIKE -> likeWeight;
            case DOWNLOAD -> downloadWeight;
            case SHARE -> shareWeight;
        };
    }
}
