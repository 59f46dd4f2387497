package com.lexkb.search.index;

import java.util.List;

public record ReindexReport(
    ReindexStatus status,
    int indexed,
    int skipped,
    List<String> skippedDocIds,
    int replayedWrites,
    long generationVersion,
    long durationMs
) {
    public ReindexReport {
        skippedDocIds = skippedDocIds == null ? List.of() : List.copyOf(skippedDocIds);
    }
}
