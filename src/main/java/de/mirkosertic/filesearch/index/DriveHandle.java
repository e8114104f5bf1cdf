package de.mirkosertic.filesearch.index;

import de.mirkosertic.filesearch.store.DriveStore;
import org.jspecify.annotations.Nullable;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-drive slot holding the published store generation and the index state.
 * <p>
 * Readers take the published store without locking. Writers hold {@link #writeLock()} around
 * copy-on-write and the reference swap; state changes and the in-flight build are guarded by
 * the handle's monitor. Code needing both takes the write lock first.
 */
public final class DriveHandle {

    private final DriveSpec spec;
    private final AtomicReference<@Nullable DriveStore> published = new AtomicReference<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile IndexState state = IndexState.notBuilt();
    private @Nullable CompletableFuture<BuildOutcome> inFlightBuild;

    DriveHandle(final DriveSpec spec) {
        this.spec = spec;
    }

    public DriveSpec spec() {
        return spec;
    }

    public String id() {
        return spec.id();
    }

    public @Nullable DriveStore published() {
        return published.get();
    }

    public IndexState state() {
        return state;
    }

    synchronized void transition(final IndexState next) {
        state = state.transitionTo(next);
    }

    /**
     * Replaces the count of a ready drive after a delta; other phases are left alone.
     */
    synchronized void refreshCount(final long count) {
        if (state.phase() == IndexState.Phase.READY) {
            state = IndexState.ready(count, state.generationId());
        }
    }

    synchronized @Nullable CompletableFuture<BuildOutcome> inFlightBuild() {
        return inFlightBuild;
    }

    synchronized void inFlightBuild(final @Nullable CompletableFuture<BuildOutcome> future) {
        this.inFlightBuild = future;
    }

    ReentrantLock writeLock() {
        return writeLock;
    }

    void publish(final DriveStore store) {
        writeLock.lock();
        try {
            published.set(store);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "DriveHandle{" + spec.id() + ", " + state.phase() + "}";
    }
}
