package com.lexkb.search.index;

import com.lexkb.search.document.DocumentStoreAdapter;
import com.lexkb.search.document.SearchDocument;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class IndexRepairService {
    private static final Logger log = LoggerFactory.getLogger(IndexRepairService.class);

    private final IndexBuilder indexBuilder;
    private final DocumentStoreAdapter storeAdapter;
    private final Executor indexingExecutor;
    private final Counter repairCounter;
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    public IndexRepairService(
        IndexBuilder indexBuilder,
        DocumentStoreAdapter storeAdapter,
        @Qualifier("indexingExecutor") Executor indexingExecutor,
        MeterRegistry meterRegistry
    ) {
        this.indexBuilder = indexBuilder;
        this.storeAdapter = storeAdapter;
        this.indexingExecutor = indexingExecutor;
        this.repairCounter = meterRegistry.counter("kb_index_repair_total");
    }

    public void schedule(String docId) {
        if (docId == null || !pending.add(docId)) {
            return;
        }
        try {
            indexingExecutor.execute(() -> repairNow(docId));
        } catch (RejectedExecutionException ex) {
            log.warn("index_repair_deferred doc_id={} reason={}", docId, ex.getMessage());
        }
    }

    public boolean repairNow(String docId) {
        try {
            Optional<SearchDocument> snapshot = storeAdapter.get(docId);
            boolean changed = indexBuilder.repair(docId, snapshot.orElse(null));
            if (changed) {
                repairCounter.increment();
            }
            return changed;
        } catch (RuntimeException ex) {
            log.warn("index_repair_failed doc_id={} reason={}", docId, ex.getMessage());
            return false;
        } finally {
            pending.remove(docId);
        }
    }

    public int drainPending() {
        List<String> ids = new ArrayList<>(pending);
        int repaired = 0;
        for (String docId : ids) {
            if (repairNow(docId)) {
                repaired++;
            }
        }
        return repaired;
    }

    public Set<String> pendingDocIds() {
        return Set.copyOf(pending);
    }
}
