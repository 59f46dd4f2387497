package com.lexkb.search.maintenance;

import com.lexkb.search.cache.QueryResultCache;
import com.lexkb.search.document.DocumentStoreAdapter;
import com.lexkb.search.index.CancellationToken;
import com.lexkb.search.index.IndexBuilder;
import com.lexkb.search.index.IndexRepairService;
import com.lexkb.search.index.ReindexJob;
import com.lexkb.search.recommend.RecommendationEngine;
import com.lexkb.search.service.KnowledgeSearchService;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class MaintenanceScheduler {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final MaintenanceProperties properties;
    private final QueryResultCache queryResultCache;
    private final DocumentStoreAdapter storeAdapter;
    private final IndexRepairService repairService;
    private final IndexBuilder indexBuilder;
    private final KnowledgeSearchService searchService;
    private final RecommendationEngine recommendationEngine;
    private final Clock clock;
    private final CancellationToken token = new CancellationToken();
    private Instant lastReindexAt;
    private ReindexJob lastJob;

    public MaintenanceScheduler(
        MaintenanceProperties properties,
        QueryResultCache queryResultCache,
        DocumentStoreAdapter storeAdapter,
        IndexRepairService repairService,
        IndexBuilder indexBuilder,
        KnowledgeSearchService searchService,
        RecommendationEngine recommendationEngine,
        Clock clock
    ) {
        this.properties = properties;
        this.queryResultCache = queryResultCache;
        this.storeAdapter = storeAdapter;
        this.repairService = repairService;
        this.indexBuilder = indexBuilder;
        this.searchService = searchService;
        this.recommendationEngine = recommendationEngine;
        this.clock = clock;
        this.lastReindexAt = clock.instant();
    }

    @Scheduled(
        fixedDelayString = "${knowledge.search.maintenance.interval-ms:60000}",
        initialDelayString = "${knowledge.search.maintenance.interval-ms:60000}"
    )
    public void runScheduled() {
        if (!properties.isEnabled() || token.isCancelled()) {
            return;
        }
        try {
            runMaintenance();
        } catch (RuntimeException ex) {
            log.warn("maintenance_failed reason={}", ex.getMessage());
        }
    }

    @PreDestroy
    public void stop() {
        token.cancel();
        log.info("maintenance_stopped");
    }

    public synchronized MaintenanceReport runMaintenance() {
        if (token.isCancelled()) {
            return MaintenanceReport.SKIPPED;
        }
        int purgedCache = queryResultCache.purge(indexBuilder.current().getVersion());
        int purgedSnapshots = storeAdapter.purgeExpired();
        int purgedProfiles = recommendationEngine.purgeExpiredProfiles();
        int repaired = repairService.drainPending();
        boolean reindexStarted = maybeReindex();
        if (purgedCache > 0 || purgedProfiles > 0 || repaired > 0 || reindexStarted) {
            log.info(
                "maintenance_run purged_cache={} purged_snapshots={} purged_profiles={} repaired={} reindex_started={}",
                purgedCache,
                purgedSnapshots,
                purgedProfiles,
                repaired,
                reindexStarted
            );
        }
        return new MaintenanceReport(purgedCache, purgedSnapshots, purgedProfiles, repaired, reindexStarted);
    }

    public boolean isActive() {
        return properties.isEnabled() && !token.isCancelled();
    }

    public Optional<ReindexJob> lastReindexJob() {
        return Optional.ofNullable(lastJob);
    }

    private boolean maybeReindex() {
        long reindexInterval = properties.getReindexIntervalMs();
        if (reindexInterval <= 0 || !storeAdapter.hasContentStore() || indexBuilder.isRebuildRunning()) {
            return false;
        }
        Instant now = clock.instant();
        if (now.isBefore(lastReindexAt.plusMillis(reindexInterval))) {
            return false;
        }
        Optional<ReindexJob> job = searchService.reindexFromContentStore(token);
        if (job.isEmpty()) {
            return false;
        }
        lastReindexAt = now;
        lastJob = job.get();
        return true;
    }
}
