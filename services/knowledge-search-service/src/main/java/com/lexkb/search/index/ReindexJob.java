package com.lexkb.search.index;

import java.util.concurrent.CompletableFuture;

public final class ReindexJob {
    private final CancellationToken token;
    private final CompletableFuture<ReindexReport> future;

    ReindexJob(CancellationToken token, CompletableFuture<ReindexReport> future) {
        this.token = token;
        this.future = future;
    }

    public void cancel() {
        token.cancel();
    }

    public boolean isCancellationRequested() {
        return token.isCancelled();
    }

    public CompletableFuture<ReindexReport> future() {
        return future;
    }
}
