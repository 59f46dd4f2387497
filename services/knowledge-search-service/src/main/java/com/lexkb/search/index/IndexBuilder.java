package com.lexkb.search.index;

import com.lexkb.search.document.DocumentStoreAdapter;
import com.lexkb.search.document.SearchDocument;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Single writer of the index. Mutations are serialized by {@link #writerLock}; each one derives a
 * draft from the current generation and publishes it with one atomic pointer swap. Readers call
 * {@link #current()} and never take the lock.
 *
 * <p>A full rebuild constructs its generation on the indexing executor without holding the lock.
 * Writes accepted while it runs are applied to the live generation and also journaled; the journal
 * is replayed onto the rebuilt generation under the lock right before the swap.
 */
@Component
public class IndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    private final DocumentAnalyzer documentAnalyzer;
    private final DocumentStoreAdapter storeAdapter;
    private final Executor indexingExecutor;
    private final IndexProperties properties;
    private final EmbeddingHook embeddingHook;
    private final Clock clock;
    private final Counter failureCounter;

    private final AtomicReference<IndexGeneration> current = new AtomicReference<>(IndexGeneration.empty());
    private final ReentrantLock writerLock = new ReentrantLock();
    private final AtomicLong versions = new AtomicLong();
    private final AtomicLong indexedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final AtomicLong timedCount = new AtomicLong();
    private final AtomicLong timedNanos = new AtomicLong();
    private volatile Instant lastIndexedAt;
    private List<JournalEntry> journal;
    // written under writerLock, read without it
    private volatile boolean rebuildRunning;

    public IndexBuilder(
        DocumentAnalyzer documentAnalyzer,
        DocumentStoreAdapter storeAdapter,
        @Qualifier("indexingExecutor") Executor indexingExecutor,
        IndexProperties properties,
        EmbeddingHook embeddingHook,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        this.documentAnalyzer = documentAnalyzer;
        this.storeAdapter = storeAdapter;
        this.indexingExecutor = indexingExecutor;
        this.properties = properties;
        this.embeddingHook = embeddingHook == null ? EmbeddingHook.NOOP : embeddingHook;
        this.clock = clock;
        this.failureCounter = meterRegistry.counter("kb_index_failure_total");
    }

    public IndexGeneration current() {
        return current.get();
    }

    public IndexResult index(SearchDocument document, IndexOptions options) {
        long started = System.nanoTime();
        String docId = document == null ? null : document.getId();
        AnalyzedDocument analyzed;
        try {
            analyzed = documentAnalyzer.analyze(document, options);
        } catch (DocumentIndexingException ex) {
            recordFailure(docId, ex);
            return IndexResult.failure(docId, elapsedMs(started), ex.getMessage());
        }

        writerLock.lock();
        try {
            GenerationDraft draft = GenerationDraft.from(current.get());
            draft.put(analyzed);
            publish(draft);
            if (journal != null) {
                journal.add(JournalEntry.put(analyzed));
            }
        } finally {
            writerLock.unlock();
        }

        storeAdapter.remember(analyzed.entry().getDocument());
        notifyIndexed(analyzed);
        long elapsedNanos = System.nanoTime() - started;
        indexedCount.incrementAndGet();
        timedCount.incrementAndGet();
        timedNanos.addAndGet(elapsedNanos);
        lastIndexedAt = clock.instant();
        return IndexResult.success(docId, TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
    }

    public boolean remove(String docId) {
        if (docId == null || docId.isBlank()) {
            return false;
        }
        boolean removed = false;
        writerLock.lock();
        try {
            IndexGeneration live = current.get();
            if (live.contains(docId)) {
                GenerationDraft draft = GenerationDraft.from(live);
                draft.remove(docId);
                publish(draft);
                removed = true;
            }
            if (journal != null) {
                journal.add(JournalEntry.remove(docId));
            }
        } finally {
            writerLock.unlock();
        }
        storeAdapter.evict(docId);
        if (removed) {
            try {
                embeddingHook.onRemoved(docId);
            } catch (RuntimeException ex) {
                log.warn("embedding_hook_failed doc_id={} reason={}", docId, ex.getMessage());
            }
        }
        return removed;
    }

    public ReindexJob reindexAll(Iterator<SearchDocument> source, IndexOptions options, CancellationToken token) {
        if (source == null) {
            throw new IllegalArgumentException("reindex source required");
        }
        CancellationToken effectiveToken = token == null ? new CancellationToken() : token;
        IndexOptions effectiveOptions = options == null ? IndexOptions.defaults() : options;
        writerLock.lock();
        try {
            if (journal != null) {
                throw new IllegalStateException("rebuild already running");
            }
            journal = new ArrayList<>();
            rebuildRunning = true;
        } finally {
            writerLock.unlock();
        }

        CompletableFuture<ReindexReport> future = new CompletableFuture<>();
        try {
            indexingExecutor.execute(() -> runRebuild(source, effectiveOptions, effectiveToken, future));
        } catch (RejectedExecutionException ex) {
            abandonJournal();
            throw ex;
        }
        log.info("reindex_started batch_size={}", batchSize());
        return new ReindexJob(effectiveToken, future);
    }

    /**
     * Removes every posting of {@code docId} by scanning the term dictionary and, when
     * {@code replacement} is given, indexes it afresh. Used for documents whose postings outlived
     * their forward entry. Returns false when the generation already has a forward entry for the
     * document, which means a regular write repaired it in the meantime.
     */
    public boolean repair(String docId, SearchDocument replacement) {
        AnalyzedDocument analyzed = null;
        if (replacement != null) {
            try {
                analyzed = documentAnalyzer.analyze(replacement, IndexOptions.defaults());
            } catch (DocumentIndexingException ex) {
                recordFailure(docId, ex);
            }
        }
        writerLock.lock();
        try {
            IndexGeneration live = current.get();
            if (live.contains(docId)) {
                return false;
            }
            GenerationDraft draft = GenerationDraft.from(live);
            int purged = draft.purgePostings(docId);
            if (analyzed != null) {
                draft.put(analyzed);
            }
            if (purged == 0 && analyzed == null) {
                return false;
            }
            publish(draft);
            if (journal != null) {
                journal.add(analyzed == null ? JournalEntry.remove(docId) : JournalEntry.put(analyzed));
            }
            log.info("index_repaired doc_id={} purged_postings={} reindexed={}", docId, purged, analyzed != null);
        } finally {
            writerLock.unlock();
        }
        if (analyzed != null) {
            notifyIndexed(analyzed);
        }
        return true;
    }

    /** Publishes the contents of an earlier generation under a new version. */
    public IndexGeneration rollbackTo(IndexGeneration snapshot) {
        writerLock.lock();
        try {
            if (journal != null) {
                throw new IllegalStateException("rollback not allowed while a rebuild is running");
            }
            IndexGeneration published = publish(GenerationDraft.from(snapshot));
            log.info("index_rolled_back from_version={} to_version={}", snapshot.getVersion(), published.getVersion());
            return published;
        } finally {
            writerLock.unlock();
        }
    }

    public boolean isRebuildRunning() {
        return rebuildRunning;
    }

    public IndexingStats stats() {
        long timed = timedCount.get();
        double averageMs = timed == 0 ? 0.0 : timedNanos.get() / 1_000_000.0 / timed;
        IndexGeneration live = current.get();
        return new IndexingStats(
            live.getDocCount(),
            indexedCount.get(),
            failedCount.get(),
            averageMs,
            lastIndexedAt,
            live.getVersion(),
            isRebuildRunning()
        );
    }

    private void runRebuild(
        Iterator<SearchDocument> source,
        IndexOptions options,
        CancellationToken token,
        CompletableFuture<ReindexReport> future
    ) {
        long started = System.nanoTime();
        int indexed = 0;
        List<String> skippedIds = new ArrayList<>();
        int skipped = 0;
        GenerationDraft draft = new GenerationDraft();
        try {
            int batchSize = batchSize();
            List<SearchDocument> batch = new ArrayList<>(batchSize);
            while (true) {
                if (token.isCancelled()) {
                    draft = null;
                    abandonJournal();
                    log.info("reindex_cancelled indexed={} skipped={}", indexed, skipped);
                    future.complete(new ReindexReport(
                        ReindexStatus.CANCELLED,
                        indexed,
                        skipped,
                        skippedIds,
                        0,
                        current.get().getVersion(),
                        elapsedMs(started)
                    ));
                    return;
                }
                batch.clear();
                while (batch.size() < batchSize && source.hasNext()) {
                    batch.add(source.next());
                }
                if (batch.isEmpty()) {
                    break;
                }
                for (SearchDocument document : batch) {
                    try {
                        draft.put(documentAnalyzer.analyze(document, options));
                        indexed++;
                    } catch (DocumentIndexingException ex) {
                        recordFailure(ex.getDocId(), ex);
                        skipped++;
                        if (ex.getDocId() != null && skippedIds.size() < properties.getMaxReportedSkips()) {
                            skippedIds.add(ex.getDocId());
                        }
                    }
                }
            }

            int replayed;
            IndexGeneration published;
            writerLock.lock();
            try {
                replayed = journal.size();
                for (JournalEntry entry : journal) {
                    entry.applyTo(draft);
                }
                published = publish(draft);
                journal = null;
                rebuildRunning = false;
            } finally {
                writerLock.unlock();
            }
            indexedCount.addAndGet(indexed);
            lastIndexedAt = clock.instant();
            long durationMs = elapsedMs(started);
            log.info(
                "reindex_finished version={} indexed={} skipped={} replayed={} took_ms={}",
                published.getVersion(),
                indexed,
                skipped,
                replayed,
                durationMs
            );
            future.complete(new ReindexReport(
                ReindexStatus.COMPLETED,
                indexed,
                skipped,
                skippedIds,
                replayed,
                published.getVersion(),
                durationMs
            ));
        } catch (RuntimeException | OutOfMemoryError ex) {
            draft = null;
            abandonJournal();
            log.error("reindex_aborted indexed={} reason={}", indexed, ex.toString());
            future.completeExceptionally(ex);
        }
    }

    private IndexGeneration publish(GenerationDraft draft) {
        IndexGeneration next = draft.build(versions.incrementAndGet());
        current.set(next);
        log.debug("generation_published version={} docs={}", next.getVersion(), next.getDocCount());
        return next;
    }

    private void abandonJournal() {
        writerLock.lock();
        try {
            journal = null;
            rebuildRunning = false;
        } finally {
            writerLock.unlock();
        }
    }

    private void notifyIndexed(AnalyzedDocument analyzed) {
        try {
            embeddingHook.onIndexed(analyzed.entry().getDocId(), analyzed.entry().getTermVector());
        } catch (RuntimeException ex) {
            log.warn("embedding_hook_failed doc_id={} reason={}", analyzed.entry().getDocId(), ex.getMessage());
        }
    }

    private void recordFailure(String docId, DocumentIndexingException ex) {
        failedCount.incrementAndGet();
        failureCounter.increment();
        log.warn("index_failed doc_id={} reason={}", docId, ex.getMessage());
    }

    private int batchSize() {
        return Math.max(1, properties.getBatchSize());
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static final class JournalEntry {
        private final AnalyzedDocument analyzed;
        private final String removedDocId;

        private JournalEntry(AnalyzedDocument analyzed, String removedDocId) {
            this.analyzed = analyzed;
            this.removedDocId = removedDocId;
        }

        static JournalEntry put(AnalyzedDocument analyzed) {
            return new JournalEntry(analyzed, null);
        }

        static JournalEntry remove(String docId) {
            return new JournalEntry(null, docId);
        }

        void applyTo(GenerationDraft draft) {
            if (analyzed != null) {
                draft.put(analyzed);
            } else {
                draft.remove(removedDocId);
            }
        }
    }
}
