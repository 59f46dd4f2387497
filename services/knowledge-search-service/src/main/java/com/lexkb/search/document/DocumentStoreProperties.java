package com.lexkb.search.document;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "knowledge.search.store")
public class DocumentStoreProperties {
    private long snapshotTtlMs = 600000;
    private int maxSnapshots = 5000;

    public long getSnapshotTtlMs() {
        return snapshotTtlMs;
    }

    public void setSnapshotTtlMs(long snapshotTtlMs) {
        this.snapshotTtlMs = snapshotTtlMs;
    }

    public int getMaxSnapshots() {
        return maxSnapshots;
    }

    public void setMaxSnapshots(int maxSnapshots) {
        this.maxSnapshots = maxSnapshots;
    }
}
