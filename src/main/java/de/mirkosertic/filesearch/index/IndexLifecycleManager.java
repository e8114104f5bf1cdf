package de.mirkosertic.filesearch.index;

import de.mirkosertic.filesearch.store.DriveStore;
import de.mirkosertic.filesearch.store.DriveStoreBuilder;
import de.mirkosertic.filesearch.store.FileEntry;
import de.mirkosertic.filesearch.store.StoreSnapshots;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the per-drive index state machines: builds, publication and incremental updates.
 *
 * <p>Builds run on the index worker pool and are coalesced per drive: while a build is in flight every
 * further request receives the same future. A new generation is published by swapping the drive's
 * store reference; a failed build leaves the previously published generation in place.</p>
 *
 * <p>Deltas are applied copy-on-write against the published generation and keep its generation id,
 * so record ids stay valid across them. They are serialized per drive by the drive's write lock.</p>
 */
public class IndexLifecycleManager {

    private static final Logger logger = LoggerFactory.getLogger(IndexLifecycleManager.class);

    private final DriveRegistry registry;
    private final DriveWalker walker;
    private final WorkerPool indexPool;
    private final @Nullable Path snapshotDirectory;
    private final AtomicLong generationCounter = new AtomicLong(0);
    private final List<IndexEventListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param snapshotDirectory directory for snapshots written after each successful build,
     *                          or {@code null} to disable snapshot writing
     */
    public IndexLifecycleManager(final DriveRegistry registry, final DriveWalker walker, final WorkerPool indexPool,
                                 final @Nullable Path snapshotDirectory) {
        this.registry = registry;
        this.walker = walker;
        this.indexPool = indexPool;
        this.snapshotDirectory = snapshotDirectory;
    }

    public void addListener(final IndexEventListener listener) {
        listeners.add(listener);
    }

    public DriveRegistry registry() {
        return registry;
    }

    public IndexState status(final String drive) {
        return registry.require(drive).state();
    }

    /**
     * Starts a build of the drive, or joins the one already in flight.
     *
     * @throws IllegalArgumentException if the drive is not configured
     */
    public CompletableFuture<BuildOutcome> buildOrRebuild(final String drive) {
        final DriveHandle handle = registry.require(drive);
        final CompletableFuture<BuildOutcome> future;
        synchronized (handle) {
            final CompletableFuture<BuildOutcome> inFlight = handle.inFlightBuild();
            if (inFlight != null) {
                logger.debug("Build of drive '{}' already in progress, joining it", drive);
                return inFlight;
            }
            handle.transition(IndexState.building());
            future = new CompletableFuture<>();
            handle.inFlightBuild(future);
        }
        for (final IndexEventListener listener : listeners) {
            notifySafely(() -> listener.onIndexBuilding(drive));
        }
        try {
            indexPool.execute(() -> runBuild(handle, future));
        } catch (final RejectedExecutionException e) {
            logger.warn("Index worker pool rejected build of drive '{}'", drive);
            synchronized (handle) {
                handle.transition(IndexState.failed("Index worker pool is shut down"));
                handle.inFlightBuild(null);
            }
            future.complete(BuildOutcome.failure(drive, "Index worker pool is shut down", 0));
        }
        return future;
    }

    /**
     * Builds the given drives concurrently and reports which of them succeeded.
     */
    public CompletableFuture<BuildSummary> buildAll(final Collection<String> drives) {
        final List<CompletableFuture<BuildOutcome>> futures = new ArrayList<>();
        for (final String drive : drives) {
            futures.add(buildOrRebuild(drive));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    final List<String> built = new ArrayList<>();
                    final List<String> failed = new ArrayList<>();
                    for (final CompletableFuture<BuildOutcome> f : futures) {
                        final BuildOutcome outcome = f.join();
                        (outcome.success() ? built : failed).add(outcome.drive());
                    }
                    final BuildSummary summary = new BuildSummary(built, failed);
                    logger.info("Index rebuild finished: {}", summary.message());
                    for (final IndexEventListener listener : listeners) {
                        notifySafely(() -> listener.onRebuildFinished(summary));
                    }
                    return summary;
                });
    }

    /**
     * Adds entries and removes records by id from the published generation.
     * Removals are applied before additions.
     */
    public CompletableFuture<DeltaResult> applyDelta(final String drive, final List<FileEntry> added,
                                                     final Collection<Integer> removedIds) {
        final DriveHandle handle = registry.require(drive);
        final List<FileEntry> additions = List.copyOf(added);
        final List<Integer> removals = List.copyOf(removedIds);
        return indexPool.supply(() -> applyChanges(handle, additions, removals.size(), builder -> {
            int removed = 0;
            for (final int id : removals) {
                if (builder.remove(id)) {
                    removed++;
                }
            }
            return removed;
        }));
    }

    /**
     * Like {@link #applyDelta} but removes records by full path, resolved through the name index.
     */
    public CompletableFuture<DeltaResult> applyPathDelta(final String drive, final List<FileEntry> added,
                                                         final Collection<String> removedPaths) {
        final DriveHandle handle = registry.require(drive);
        final List<FileEntry> additions = List.copyOf(added);
        final List<String> removals = List.copyOf(removedPaths);
        return indexPool.supply(() -> applyChanges(handle, additions, removals.size(), builder -> {
            int removed = 0;
            for (final String path : removals) {
                if (builder.removeByPath(path)) {
                    removed++;
                }
            }
            return removed;
        }));
    }

    /**
     * Publishes a generation from each drive's snapshot file, if present. Drives with a published
     * generation are left alone.
     *
     * @return number of drives loaded
     */
    public int loadSnapshots(final Path directory) {
        int loaded = 0;
        for (final DriveHandle handle : registry.all()) {
            final Path file = StoreSnapshots.fileFor(directory, handle.id());
            if (!Files.isRegularFile(file)) {
                continue;
            }
            handle.writeLock().lock();
            try {
                synchronized (handle) {
                    if (handle.published() != null || handle.inFlightBuild() != null) {
                        continue;
                    }
                    final long start = System.currentTimeMillis();
                    try {
                        final DriveStore store = StoreSnapshots.read(file, handle.id(),
                                generationCounter.incrementAndGet());
                        handle.transition(IndexState.building());
                        handle.publish(store);
                        handle.transition(IndexState.ready(store.liveCount(), store.generation()));
                        logger.info("Loaded drive '{}' from snapshot with {} records in {}ms",
                                handle.id(), store.liveCount(), System.currentTimeMillis() - start);
                        loaded++;
                    } catch (final IOException | RuntimeException e) {
                        logger.warn("Failed to load snapshot {} for drive '{}'", file, handle.id(), e);
                    }
                }
            } finally {
                handle.writeLock().unlock();
            }
        }
        return loaded;
    }

    private void runBuild(final DriveHandle handle, final CompletableFuture<BuildOutcome> future) {
        final String drive = handle.id();
        final long start = System.currentTimeMillis();
        final long generation = generationCounter.incrementAndGet();
        logger.info("Building index for drive '{}' from {} (generation {})", drive, handle.spec().root(), generation);

        BuildOutcome outcome;
        DriveStore store = null;
        Error fatal = null;
        try {
            final DriveStoreBuilder builder = DriveStoreBuilder.newGeneration(drive, generation);
            walker.walk(handle.spec(), builder::add);
            store = builder.build();
            final long duration = System.currentTimeMillis() - start;
            publishBuilt(handle, store);
            outcome = BuildOutcome.success(drive, store.liveCount(), generation, duration);
            logger.info("Index for drive '{}' ready with {} records in {}ms", drive, store.liveCount(), duration);
        } catch (final Exception | Error e) {
            final String reason = describe(e);
            if (e instanceof Error error) {
                logger.error("Index build for drive '{}' aborted: {}", drive, reason, e);
                fatal = error;
            } else {
                logger.warn("Index build for drive '{}' failed: {}", drive, reason, e);
            }
            synchronized (handle) {
                handle.transition(IndexState.failed(reason));
                handle.inFlightBuild(null);
            }
            outcome = BuildOutcome.failure(drive, reason, System.currentTimeMillis() - start);
            store = null;
        }

        future.complete(outcome);

        final BuildOutcome finished = outcome;
        for (final IndexEventListener listener : listeners) {
            if (finished.success()) {
                notifySafely(() -> listener.onIndexCompleted(finished));
            } else {
                notifySafely(() -> listener.onIndexFailed(drive, finished.reason()));
            }
        }

        if (fatal != null) {
            throw fatal;
        }
        if (store != null && snapshotDirectory != null) {
            try {
                StoreSnapshots.write(store, StoreSnapshots.fileFor(snapshotDirectory, drive));
            } catch (final IOException e) {
                logger.warn("Failed to write snapshot for drive '{}'", drive, e);
            }
        }
    }

    /**
     * Swaps in a built generation and marks the drive ready. The write lock is taken before the
     * handle's monitor, the same order delta application uses.
     */
    private static void publishBuilt(final DriveHandle handle, final DriveStore store) {
        handle.writeLock().lock();
        try {
            synchronized (handle) {
                handle.publish(store);
                handle.transition(IndexState.ready(store.liveCount(), store.generation()));
                handle.inFlightBuild(null);
            }
        } finally {
            handle.writeLock().unlock();
        }
    }

    private DeltaResult applyChanges(final DriveHandle handle, final List<FileEntry> additions,
                                     final int requestedRemovals, final Removal removal) {
        handle.writeLock().lock();
        try {
            final DriveStore current = handle.published();
            if (current == null) {
                logger.debug("Ignoring delta for drive '{}' without a published generation", handle.id());
                return DeltaResult.notApplied(handle.id());
            }
            final DriveStoreBuilder builder = current.toBuilder();
            final int removed = removal.apply(builder);
            for (final FileEntry entry : additions) {
                builder.add(entry);
            }
            final DriveStore next = builder.build();
            handle.publish(next);
            handle.refreshCount(next.liveCount());
            logger.debug("Applied delta to drive '{}': {} added, {} of {} removed, {} live",
                    handle.id(), additions.size(), removed, requestedRemovals, next.liveCount());
            return new DeltaResult(handle.id(), true, additions.size(), removed, next.liveCount());
        } finally {
            handle.writeLock().unlock();
        }
    }

    private static String describe(final Throwable e) {
        final String message = e.getMessage();
        return message == null || message.isBlank()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + message;
    }

    private static void notifySafely(final Runnable notification) {
        try {
            notification.run();
        } catch (final RuntimeException e) {
            logger.warn("Index event listener failed", e);
        }
    }

    @FunctionalInterface
    private interface Removal {
        int apply(DriveStoreBuilder builder);
    }
}
