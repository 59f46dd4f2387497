package com.lexkb.search.maintenance;

public record MaintenanceReport(
    int purgedCacheEntries,
    int purgedSnapshots,
    int purgedProfiles,
    int repairedDocuments,
    boolean reindexStarted
) {
    static final MaintenanceReport SKIPPED = new MaintenanceReport(0, 0, 0, 0, false);
}
