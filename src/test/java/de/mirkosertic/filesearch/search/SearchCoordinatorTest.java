package de.mirkosertic.filesearch.search;

import de.mirkosertic.filesearch.index.DriveRegistry;
import de.mirkosertic.filesearch.index.DriveSpec;
import de.mirkosertic.filesearch.index.IndexLifecycleManager;
import de.mirkosertic.filesearch.index.WorkerPool;
import de.mirkosertic.filesearch.query.Query;
import de.mirkosertic.filesearch.query.QueryCompiler;
import de.mirkosertic.filesearch.store.FileEntry;
import de.mirkosertic.filesearch.store.MatchMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static de.mirkosertic.filesearch.store.TestEntries.file;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@DisplayName("SearchCoordinator Tests")
class SearchCoordinatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-12-15T12:00:00Z"), ZoneOffset.UTC);

    /**
     * Records every callback as {@code batch:<session>:<size>} or {@code complete:<session>}.
     */
    private static final class RecordingListener implements SearchEventListener {

        final List<String> events = Collections.synchronizedList(new ArrayList<>());
        final CountDownLatch completions;
        final CountDownLatch firstBatch = new CountDownLatch(1);
        final AtomicReference<SearchCompletion> lastCompletion = new AtomicReference<>();
        volatile long batchDelayMs;

        RecordingListener(final int expectedCompletions) {
            this.completions = new CountDownLatch(expectedCompletions);
        }

        @Override
        public void onBatch(final SearchSession session, final ResultBatch batch) {
            events.add("batch:" + session.id() + ":" + batch.size());
            firstBatch.countDown();
            if (batchDelayMs > 0) {
                try {
                    Thread.sleep(batchDelayMs);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }

        @Override
        public void onComplete(final SearchSession session, final SearchCompletion completion) {
            events.add("complete:" + session.id());
            lastCompletion.set(completion);
            completions.countDown();
        }

        long hits(final long sessionId) {
            synchronized (events) {
                return events.stream()
                        .filter(e -> e.startsWith("batch:" + sessionId + ":"))
                        .mapToLong(e -> Long.parseLong(e.substring(e.lastIndexOf(':') + 1)))
                        .sum();
            }
        }
    }

    private WorkerPool indexPool;
    private WorkerPool searchPool;
    private DriveRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        final List<FileEntry> entries = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            entries.add(file(String.format("/a/data/item%02d.txt", i), i));
        }
        entries.add(file("/a/data/summary.doc", 1));
        final Map<String, List<FileEntry>> perDrive = Map.of("A", entries);

        indexPool = new WorkerPool("test-index", 1);
        searchPool = new WorkerPool("test-search", 4);
        registry = new DriveRegistry(List.of(
                new DriveSpec("A", Path.of("/a")),
                new DriveSpec("B", Path.of("/b"))));
        final IndexLifecycleManager manager = new IndexLifecycleManager(registry,
                (drive, sink) -> perDrive.get(drive.id()).forEach(sink), indexPool, null);
        manager.buildOrRebuild("A").get(5, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() {
        searchPool.shutdown();
        indexPool.shutdown();
    }

    private SearchCoordinator coordinator(final int batchSize, final int capacity, final long abandonMs) {
        return new SearchCoordinator(registry, new SearchExecutor(MatchMode.SIMPLE, 1000, batchSize), searchPool,
                capacity, abandonMs, CLOCK);
    }

    @Test
    @DisplayName("Searching all drives should skip drives without a published generation")
    void allScopeSkipsUnbuiltDrives() throws InterruptedException {
        final ResultStream stream = coordinator(10, 8, 30_000)
                .search("k", QueryCompiler.parse("item"), SearchScope.all());

        final List<SearchHit> hits = stream.collectAll();
        final SearchCompletion completion = stream.completion();

        assertThat(hits).hasSize(50).allMatch(hit -> hit.drive().equals("A"));
        assertThat(completion.totalCount()).isEqualTo(50);
        assertThat(completion.driveStatuses())
                .containsEntry("A", DriveSearchStatus.READY)
                .containsEntry("B", DriveSearchStatus.NOT_READY);
        assertThat(completion.notReady()).isFalse();
        assertThat(completion.superseded()).isFalse();
    }

    @Test
    @DisplayName("Searching only unbuilt or unknown drives should report not ready")
    void notReady() throws InterruptedException {
        final SearchCoordinator coordinator = coordinator(10, 8, 30_000);

        final ResultStream unbuilt = coordinator.search("k1", Query.EMPTY, SearchScope.drive("B"));
        final ResultStream unknown = coordinator.search("k2", Query.EMPTY, SearchScope.drive("Z"));

        assertThat(unbuilt.collectAll()).isEmpty();
        assertThat(unbuilt.completion().notReady()).isTrue();
        assertThat(unknown.collectAll()).isEmpty();
        assertThat(unknown.completion().driveStatuses()).containsEntry("Z", DriveSearchStatus.NOT_READY);
        assertThat(coordinator.activeSessionCount()).isZero();
    }

    @Test
    @DisplayName("Should deliver batches in per-drive sequence order")
    void batchOrder() throws InterruptedException {
        final ResultStream stream = coordinator(7, 2, 30_000)
                .search("k", QueryCompiler.parse("item"), SearchScope.drive("A"));

        final List<Integer> sequences = new ArrayList<>();
        ResultBatch batch;
        while ((batch = stream.nextBatch()) != null) {
            sequences.add(batch.sequence());
            assertThat(batch.size()).isLessThanOrEqualTo(7);
        }

        assertThat(sequences).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(stream.session().batchCount()).isEqualTo(8);
    }

    @Test
    @DisplayName("A new search with the same key should supersede the running one")
    void supersession() throws InterruptedException {
        final SearchCoordinator coordinator = coordinator(1, 1, 30_000);

        final ResultStream first = coordinator.search("console", Query.EMPTY, SearchScope.all());
        final ResultStream second = coordinator.search("console", QueryCompiler.parse("summary"), SearchScope.all());

        final SearchCompletion firstCompletion = first.completion();
        final List<SearchHit> secondHits = second.collectAll();

        assertThat(first.session().isSuperseded()).isTrue();
        assertThat(firstCompletion.superseded()).isTrue();
        assertThat(firstCompletion.totalCount()).isLessThan(51);
        assertThat(first.nextBatch()).isNull();
        assertThat(secondHits).extracting(SearchHit::name).containsExactly("summary.doc");
        assertThat(second.completion().superseded()).isFalse();
    }

    @Test
    @DisplayName("Closing the stream should cancel the search")
    void closeCancels() throws InterruptedException {
        final SearchCoordinator coordinator = coordinator(1, 1, 30_000);
        final ResultStream stream = coordinator.search("k", Query.EMPTY, SearchScope.all());

        stream.close();
        final SearchCompletion completion = stream.completion();

        assertThat(stream.session().isCancelled()).isTrue();
        assertThat(stream.isClosed()).isTrue();
        assertThat(stream.nextBatch()).isNull();
        assertThat(completion.totalCount()).isLessThan(51);
        assertThat(coordinator.activeSessionCount()).isZero();
    }

    @Test
    @DisplayName("A consumer that stops reading should be abandoned")
    void abandonedConsumer() throws InterruptedException {
        final ResultStream stream = coordinator(1, 1, 200)
                .search("k", Query.EMPTY, SearchScope.all());

        final long deadline = System.currentTimeMillis() + 5_000;
        while (!stream.session().isCancelled() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertThat(stream.session().isCancelled()).isTrue();
        assertThat(stream.session().isSuperseded()).isFalse();
    }

    @Test
    @DisplayName("Asynchronous searches should push batches and the completion to the listener")
    void searchAsync() {
        final SearchEventListener listener = mock(SearchEventListener.class);

        final SearchSession session = coordinator(10, 8, 30_000)
                .searchAsync("k", QueryCompiler.parse("item"), SearchScope.all(), listener);

        verify(listener, timeout(2000).times(5)).onBatch(any(), any());
        verify(listener, timeout(2000)).onComplete(argThat(s -> s.id() == session.id()),
                argThat(c -> c.totalCount() == 50 && !c.superseded()));
    }

    @Test
    @DisplayName("Asynchronous searches should deliver every hit when the drives outnumber the search threads")
    void searchAsyncWithBusyPool() throws Exception {
        // Given two built drives and a search pool with only two threads
        final Map<String, List<FileEntry>> perDrive = Map.of(
                "A", numbered("/a/", 100),
                "B", numbered("/b/", 100));
        final DriveRegistry wide = new DriveRegistry(List.of(
                new DriveSpec("A", Path.of("/a")),
                new DriveSpec("B", Path.of("/b"))));
        final IndexLifecycleManager manager = new IndexLifecycleManager(wide,
                (drive, sink) -> perDrive.get(drive.id()).forEach(sink), indexPool, null);
        manager.buildAll(List.of("A", "B")).get(5, TimeUnit.SECONDS);
        final WorkerPool narrowPool = new WorkerPool("test-narrow", 2);
        try {
            final SearchCoordinator coordinator = new SearchCoordinator(wide,
                    new SearchExecutor(MatchMode.SIMPLE, 1000, 10), narrowPool, 2, 1000, CLOCK);
            final RecordingListener listener = new RecordingListener(1);

            // When
            final SearchSession session = coordinator.searchAsync("k", Query.EMPTY, SearchScope.all(), listener);

            // Then
            assertThat(listener.completions.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(listener.hits(session.id())).isEqualTo(200);
            assertThat(listener.lastCompletion.get().totalCount()).isEqualTo(200);
            assertThat(listener.lastCompletion.get().driveStatuses())
                    .containsEntry("A", DriveSearchStatus.READY)
                    .containsEntry("B", DriveSearchStatus.READY);
            assertThat(session.isCancelled()).isFalse();
        } finally {
            narrowPool.shutdown();
        }
    }

    @Test
    @DisplayName("A superseded asynchronous search should deliver nothing once its successor started")
    void searchAsyncSupersession() throws Exception {
        final SearchCoordinator coordinator = coordinator(1, 1, 30_000);
        final RecordingListener listener = new RecordingListener(2);
        listener.batchDelayMs = 20;

        // Given an asynchronous search that is delivering batches
        final SearchSession first = coordinator.searchAsync("console", Query.EMPTY, SearchScope.all(), listener);
        assertThat(listener.firstBatch.await(5, TimeUnit.SECONDS)).isTrue();

        // When a second search with the same key starts
        final SearchSession second = coordinator.searchAsync("console", QueryCompiler.parse("summary"),
                SearchScope.all(), listener);

        // Then no batch of the first arrives after the second started delivering
        assertThat(listener.completions.await(10, TimeUnit.SECONDS)).isTrue();
        final List<String> events = new ArrayList<>(listener.events);
        final int firstOfSecond = events.indexOf("batch:" + second.id() + ":1");
        final int completeOfSecond = events.indexOf("complete:" + second.id());
        int lastOfFirst = -1;
        for (int i = 0; i < events.size(); i++) {
            if (events.get(i).startsWith("batch:" + first.id() + ":")) {
                lastOfFirst = i;
            }
        }

        assertThat(first.isSuperseded()).isTrue();
        assertThat(lastOfFirst).isGreaterThanOrEqualTo(0).isLessThan(firstOfSecond);
        assertThat(firstOfSecond).isLessThan(completeOfSecond);
        assertThat(listener.hits(first.id())).isLessThan(51);
        assertThat(listener.hits(second.id())).isEqualTo(1);
    }

    private static List<FileEntry> numbered(final String folder, final int count) {
        final List<FileEntry> entries = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            entries.add(file(folder + "file" + i + ".txt", i));
        }
        return entries;
    }
}
