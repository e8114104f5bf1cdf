package de.mirkosertic.filesearch.search;

import de.mirkosertic.filesearch.index.DriveHandle;
import de.mirkosertic.filesearch.index.DriveRegistry;
import de.mirkosertic.filesearch.index.WorkerPool;
import de.mirkosertic.filesearch.query.FilterContext;
import de.mirkosertic.filesearch.query.Query;
import de.mirkosertic.filesearch.store.DriveStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans a query out over the drives in scope and merges their batches into one {@link ResultStream}.
 *
 * <p>Only drives with a published generation are scanned; the others are reported as
 * {@link DriveSearchStatus#NOT_READY}. A drive that is rebuilding, or whose last build failed, is searched
 * against its prior generation. Starting a search with a session key that is still running supersedes
 * the earlier search.</p>
 */
public class SearchCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(SearchCoordinator.class);

    private static final int DELIVERY_LOCK_STRIPES = 32;

    private final DriveRegistry registry;
    private final SearchExecutor executor;
    private final WorkerPool searchPool;
    private final int channelCapacity;
    private final long abandonTimeoutMs;
    private final Clock clock;
    private final Map<String, SearchSession> activeSessions = new ConcurrentHashMap<>();
    private final AtomicLong sessionIds = new AtomicLong(0);
    private final Object[] deliveryLocks = new Object[DELIVERY_LOCK_STRIPES];

    public SearchCoordinator(final DriveRegistry registry, final SearchExecutor executor, final WorkerPool searchPool,
                             final int channelCapacity, final long abandonTimeoutMs, final Clock clock) {
        this.registry = registry;
        this.executor = executor;
        this.searchPool = searchPool;
        this.channelCapacity = channelCapacity;
        this.abandonTimeoutMs = abandonTimeoutMs;
        this.clock = clock;
        for (int i = 0; i < deliveryLocks.length; i++) {
            deliveryLocks[i] = new Object();
        }
    }

    public ResultStream search(final String sessionKey, final Query query, final SearchScope scope) {
        final SearchSession session = open(sessionKey);
        final ResultStream stream = new ResultStream(session, channelCapacity, abandonTimeoutMs);
        final Map<String, DriveSearchStatus> statuses = Collections.synchronizedMap(new LinkedHashMap<>());
        scanAll(session, query, scope, statuses, stream::offer)
                .whenComplete((ignored, error) -> {
                    final SearchCompletion completion = complete(session, statuses);
                    stream.complete(completion);
                });
        return stream;
    }

    /**
     * Runs the search and hands each batch to the listener from the scanning thread. Deliveries for one
     * session key are serialized with each other and with supersession, so once a newer search with the
     * same key has started no batch of the older one reaches a listener. A slow listener holds up the scans
     * instead of losing batches.
     */
    public SearchSession searchAsync(final String sessionKey, final Query query, final SearchScope scope,
                                     final SearchEventListener listener) {
        final SearchSession session = open(sessionKey);
        final Object lock = deliveryLock(sessionKey);
        final Map<String, DriveSearchStatus> statuses = Collections.synchronizedMap(new LinkedHashMap<>());
        scanAll(session, query, scope, statuses, batch -> deliver(session, lock, listener, batch))
                .whenComplete((ignored, error) -> {
                    final SearchCompletion completion = complete(session, statuses);
                    synchronized (lock) {
                        try {
                            listener.onComplete(session, completion);
                        } catch (final RuntimeException e) {
                            logger.warn("Search listener failed on completion of session {}", session.id(), e);
                        }
                    }
                });
        return session;
    }

    public int activeSessionCount() {
        return activeSessions.size();
    }

    private List<DriveHandle> handlesInScope(final SearchScope scope, final Map<String, DriveSearchStatus> statuses) {
        if (scope.isAll()) {
            return registry.all();
        }
        final DriveHandle handle = registry.get(scope.drive());
        if (handle == null) {
            logger.warn("Search requested for unknown drive '{}'", scope.drive());
            statuses.put(scope.drive(), DriveSearchStatus.NOT_READY);
            return List.of();
        }
        return List.of(handle);
    }

    private SearchSession open(final String sessionKey) {
        final SearchSession session = new SearchSession(sessionKey, sessionIds.incrementAndGet());
        synchronized (deliveryLock(sessionKey)) {
            final SearchSession prior = activeSessions.put(sessionKey, session);
            if (prior != null) {
                prior.supersede();
                logger.debug("Session {} superseded by session {} for key '{}'", prior.id(), session.id(), sessionKey);
            }
        }
        return session;
    }

    private Object deliveryLock(final String sessionKey) {
        return deliveryLocks[Math.floorMod(sessionKey.hashCode(), deliveryLocks.length)];
    }

    /**
     * Starts one scan per searchable drive in scope; the returned future completes when all have ended.
     */
    private CompletableFuture<Void> scanAll(final SearchSession session, final Query query, final SearchScope scope,
                                            final Map<String, DriveSearchStatus> statuses,
                                            final SearchExecutor.BatchSink sink) {
        final List<DriveStore> targets = new ArrayList<>();
        for (final DriveHandle handle : handlesInScope(scope, statuses)) {
            final DriveStore store = handle.published();
            statuses.put(handle.id(), DriveSearchStatus.of(handle.state(), store != null));
            if (store != null) {
                targets.add(store);
            }
        }
        if (targets.isEmpty()) {
            logger.debug("Session {}: no searchable drive in scope {}", session.id(), scope);
            return CompletableFuture.completedFuture(null);
        }

        final FilterContext context = FilterContext.of(clock);
        final List<CompletableFuture<Void>> scans = new ArrayList<>();
        for (final DriveStore store : targets) {
            scans.add(CompletableFuture.runAsync(() -> scan(store, query, context, session, sink, statuses),
                    searchPool));
        }
        return CompletableFuture.allOf(scans.toArray(new CompletableFuture<?>[0]));
    }

    private void scan(final DriveStore store, final Query query, final FilterContext context,
                      final SearchSession session, final SearchExecutor.BatchSink sink,
                      final Map<String, DriveSearchStatus> statuses) {
        try {
            executor.execute(store, query, context, session, sink);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            session.cancel();
        } catch (final RuntimeException e) {
            logger.error("Search on drive '{}' failed", store.drive(), e);
            statuses.put(store.drive(), DriveSearchStatus.FAILED);
        }
    }

    private boolean deliver(final SearchSession session, final Object lock, final SearchEventListener listener,
                            final ResultBatch batch) {
        synchronized (lock) {
            if (session.isCancelled()) {
                return false;
            }
            try {
                listener.onBatch(session, batch);
            } catch (final RuntimeException e) {
                logger.warn("Search listener failed on batch of session {}, cancelling", session.id(), e);
                session.cancel();
                return false;
            }
            session.recordBatch(batch.size());
            return true;
        }
    }

    private SearchCompletion complete(final SearchSession session, final Map<String, DriveSearchStatus> statuses) {
        final Map<String, DriveSearchStatus> snapshot;
        synchronized (statuses) {
            snapshot = new LinkedHashMap<>(statuses);
        }
        final SearchCompletion completion = new SearchCompletion(session.id(), session.count(), snapshot,
                session.isSuperseded(), System.currentTimeMillis() - session.startedAt());
        activeSessions.remove(session.key(), session);
        logger.debug("Session {} completed: {} hits, superseded={}", session.id(), completion.totalCount(),
                completion.superseded());
        return completion;
    }
}
