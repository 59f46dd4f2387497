package com.lexkb.search.index;

import java.time.Instant;

public record IndexingStats(
    int totalDocuments,
    long indexedCount,
    long failedCount,
    double averageIndexTimeMs,
    Instant lastIndexedAt,
    long generationVersion,
    boolean rebuildRunning
) {}
