package com.leadradar.crawl.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal, checked by the crawl loop between pages.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }
}
