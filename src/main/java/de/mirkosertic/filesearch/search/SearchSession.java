package de.mirkosertic.filesearch.search;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State of one in-flight search. Cancellation is cooperative and checked between batches.
 */
public final class SearchSession {

    private final String key;
    private final long id;
    private final long startedAt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean superseded = new AtomicBoolean(false);
    private final AtomicInteger batches = new AtomicInteger(0);
    private final AtomicLong count = new AtomicLong(0);

    SearchSession(final String key, final long id) {
        this.key = key;
        this.id = id;
        this.startedAt = System.currentTimeMillis();
    }

    public String key() {
        return key;
    }

    public long id() {
        return id;
    }

    public long startedAt() {
        return startedAt;
    }

    public void cancel() {
        cancelled.set(true);
    }

    /**
     * Cancels the session because a newer search with the same key started.
     */
    void supersede() {
        superseded.set(true);
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isSuperseded() {
        return superseded.get();
    }

    void recordBatch(final int size) {
        batches.incrementAndGet();
        count.addAndGet(size);
    }

    public int batchCount() {
        return batches.get();
    }

    public long count() {
        return count.get();
    }

    @Override
    public String toString() {
        return "SearchSession{key=" + key + ", id=" + id + ", cancelled=" + cancelled.get() + "}";
    }
}
