package com.lexkb.search.maintenance;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "knowledge.search.maintenance")
public class MaintenanceProperties {
    private boolean enabled = true;
    private long intervalMs = 60000;
    private long reindexIntervalMs = 0;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
        this.intervalMs = intervalMs;
    }

    public long getReindexIntervalMs() {
        return reindexIntervalMs;
    }

    public void setReindexIntervalMs(long reindexIntervalMs) {
        this.reindexIntervalMs = reindexIntervalMs;
    }
}
