package de.mirkosertic.filesearch;

import de.mirkosertic.filesearch.config.ApplicationConfig;
import de.mirkosertic.filesearch.index.BuildSummary;
import de.mirkosertic.filesearch.index.DeltaResult;
import de.mirkosertic.filesearch.index.DriveHandle;
import de.mirkosertic.filesearch.index.DriveRegistry;
import de.mirkosertic.filesearch.index.DriveWalker;
import de.mirkosertic.filesearch.index.FileSystemDriveWalker;
import de.mirkosertic.filesearch.index.IndexEventListener;
import de.mirkosertic.filesearch.index.IndexLifecycleManager;
import de.mirkosertic.filesearch.index.IndexState;
import de.mirkosertic.filesearch.index.WalkFilter;
import de.mirkosertic.filesearch.index.WorkerPool;
import de.mirkosertic.filesearch.query.Query;
import de.mirkosertic.filesearch.query.QueryCompiler;
import de.mirkosertic.filesearch.search.ResultStream;
import de.mirkosertic.filesearch.search.SearchCoordinator;
import de.mirkosertic.filesearch.search.SearchEventListener;
import de.mirkosertic.filesearch.search.SearchExecutor;
import de.mirkosertic.filesearch.search.SearchScope;
import de.mirkosertic.filesearch.search.SearchSession;
import de.mirkosertic.filesearch.store.DriveStore;
import de.mirkosertic.filesearch.store.FileEntry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the search core: wires the query compiler, the index lifecycle and the search
 * coordinator over the configured drives.
 */
public class FileSearchEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FileSearchEngine.class);

    /**
     * Session key used when the caller does not supply one.
     */
    public static final String DEFAULT_SESSION = "default";

    private final ApplicationConfig config;
    private final DriveRegistry registry;
    private final WorkerPool indexPool;
    private final WorkerPool searchPool;
    private final QueryCompiler queryCompiler;
    private final IndexLifecycleManager lifecycleManager;
    private final SearchCoordinator coordinator;
    private volatile boolean closed;

    public FileSearchEngine(final ApplicationConfig config) {
        this(config, new FileSystemDriveWalker(WalkFilter.from(config)), Clock.system(config.getTimeZone()));
    }

    public FileSearchEngine(final ApplicationConfig config, final DriveWalker walker, final Clock clock) {
        this.config = config;
        this.registry = new DriveRegistry(config.getDrives());
        this.indexPool = new WorkerPool("index-worker", config.getIndexThreadPoolSize());
        this.searchPool = new WorkerPool("search-worker", config.getSearchThreadPoolSize());
        this.queryCompiler = new QueryCompiler(config.getQueryCacheSize());
        this.lifecycleManager = new IndexLifecycleManager(registry, walker, indexPool, snapshotDirectory(config));
        final SearchExecutor executor = new SearchExecutor(config.getMatchMode(), config.getMaxResultsPerDrive(),
                config.getBatchSize());
        this.coordinator = new SearchCoordinator(registry, executor, searchPool, config.getChannelCapacity(),
                config.getAbandonTimeoutMs(), clock);
    }

    private static @Nullable Path snapshotDirectory(final ApplicationConfig config) {
        if (!config.isSnapshotEnabled() || config.getSnapshotPath() == null) {
            return null;
        }
        return Paths.get(config.getSnapshotPath());
    }

    /**
     * Loads snapshots if enabled, then starts building the drives that are still unpublished
     * when building on startup is enabled. Does not wait for the builds.
     */
    public void init() {
        logger.info("Initializing file search engine with {} drive(s)", registry.ids().size());
        final Path snapshots = snapshotDirectory(config);
        if (snapshots != null && config.isLoadSnapshotOnStartup()) {
            final int loaded = lifecycleManager.loadSnapshots(snapshots);
            logger.info("Loaded {} drive(s) from snapshots in {}", loaded, snapshots);
        }
        if (config.isBuildOnStartup()) {
            final List<String> unpublished = new ArrayList<>();
            for (final DriveHandle handle : registry.all()) {
                if (handle.published() == null) {
                    unpublished.add(handle.id());
                }
            }
            if (!unpublished.isEmpty()) {
                lifecycleManager.buildAll(unpublished);
            }
        }
    }

    public ResultStream compileAndSearch(final String rawQuery, final SearchScope scope) {
        return compileAndSearch(DEFAULT_SESSION, rawQuery, scope);
    }

    /**
     * Compiles the query and starts streaming its hits. A running search with the same session key
     * is superseded.
     */
    public ResultStream compileAndSearch(final String sessionKey, final String rawQuery, final SearchScope scope) {
        final Query query = queryCompiler.compile(rawQuery);
        logger.debug("Search '{}' in scope {} for session key '{}'", rawQuery, scope, sessionKey);
        return coordinator.search(sessionKey, query, scope);
    }

    public SearchSession searchAsync(final String sessionKey, final String rawQuery, final SearchScope scope,
                                     final SearchEventListener listener) {
        return coordinator.searchAsync(sessionKey, queryCompiler.compile(rawQuery), scope, listener);
    }

    /**
     * Builds or rebuilds the drives in scope. An unknown drive is reported as failed.
     */
    public CompletableFuture<BuildSummary> buildIndex(final SearchScope scope) {
        if (scope.isAll()) {
            return lifecycleManager.buildAll(registry.ids());
        }
        if (registry.get(scope.drive()) == null) {
            logger.warn("Build requested for unknown drive '{}'", scope.drive());
            return CompletableFuture.completedFuture(new BuildSummary(List.of(), List.of(scope.drive())));
        }
        return lifecycleManager.buildAll(List.of(scope.drive()));
    }

    public IndexStatusReport checkIndexStatus(final SearchScope scope) {
        final List<DriveHandle> handles;
        if (scope.isAll()) {
            handles = registry.all();
        } else {
            final DriveHandle handle = registry.get(scope.drive());
            handles = handle == null ? List.of() : List.of(handle);
        }
        final List<IndexStatusReport.DriveStatus> perDrive = new ArrayList<>();
        int ready = 0;
        long files = 0;
        for (final DriveHandle handle : handles) {
            final IndexState state = handle.state();
            final DriveStore store = handle.published();
            final long count = store == null ? 0 : store.liveCount();
            perDrive.add(new IndexStatusReport.DriveStatus(handle.id(), state, count,
                    store == null ? 0 : store.generation()));
            if (state.phase() == IndexState.Phase.READY) {
                ready++;
            }
            files += count;
        }
        return new IndexStatusReport(perDrive, ready, handles.size(), files);
    }

    public CompletableFuture<DeltaResult> applyFsDelta(final String drive, final List<FileEntry> added,
                                                       final Collection<Integer> removedIds) {
        return lifecycleManager.applyDelta(drive, added, removedIds);
    }

    public CompletableFuture<DeltaResult> applyFsPathDelta(final String drive, final List<FileEntry> added,
                                                           final Collection<String> removedPaths) {
        return lifecycleManager.applyPathDelta(drive, added, removedPaths);
    }

    public void addIndexEventListener(final IndexEventListener listener) {
        lifecycleManager.addListener(listener);
    }

    public QueryCompiler queryCompiler() {
        return queryCompiler;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Closing file search engine, query cache: {}", queryCompiler.getStats());
        try {
            searchPool.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down search worker pool", e);
        }
        try {
            indexPool.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down index worker pool", e);
        }
    }
}
