package com.lexkb.search.index;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "knowledge.search.index")
public class IndexProperties {
    private int batchSize = 200;
    private int facetBucketLimit = 20;
    private int summaryMaxLength = 200;
    private int executorThreads = 2;
    private int maxReportedSkips = 100;

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getFacetBucketLimit() {
        return facetBucketLimit;
    }

    public void setFacetBucketLimit(int facetBucketLimit) {
        this.facetBucketLimit = facetBucketLimit;
    }

    public int getSummaryMaxLength() {
        return summaryMaxLength;
    }

    public void setSummaryMaxLength(int summaryMaxLength) {
        this.summaryMaxLength = summaryMaxLength;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getMaxReportedSkips() {
        return maxReportedSkips;
    }

    public void setMaxReportedSkips(int maxReportedSkips) {
        this.maxReportedSkips = maxReportedSkips;
    }
}
