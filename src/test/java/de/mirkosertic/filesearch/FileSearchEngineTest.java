package de.mirkosertic.filesearch;

import de.mirkosertic.filesearch.config.ApplicationConfig;
import de.mirkosertic.filesearch.index.BuildSummary;
import de.mirkosertic.filesearch.index.DeltaResult;
import de.mirkosertic.filesearch.index.DriveSpec;
import de.mirkosertic.filesearch.index.IndexEventListener;
import de.mirkosertic.filesearch.index.IndexState;
import de.mirkosertic.filesearch.search.ResultStream;
import de.mirkosertic.filesearch.search.SearchHit;
import de.mirkosertic.filesearch.search.SearchScope;
import de.mirkosertic.filesearch.store.FileEntry;
import de.mirkosertic.filesearch.store.MatchMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("FileSearchEngine Tests")
class FileSearchEngineTest {

    @TempDir
    Path tempDir;

    private Path driveA;
    private Path driveB;
    private FileSearchEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        driveA = tempDir.resolve("a");
        driveB = tempDir.resolve("b");
        Files.createDirectories(driveA.resolve("projects"));
        Files.createDirectories(driveB.resolve("music"));
        Files.writeString(driveA.resolve("projects/project_report.txt"), "report");
        Files.writeString(driveA.resolve("projects/project_backup.zip"), "backup");
        Files.writeString(driveA.resolve("projects/notes.tmp"), "skipped");
        Files.writeString(driveB.resolve("music/song.mp3"), "la la la");
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private ApplicationConfig config(final boolean buildOnStartup, final boolean snapshots) {
        final ApplicationConfig config = mock(ApplicationConfig.class);
        when(config.getDrives()).thenReturn(List.of(new DriveSpec("A", driveA), new DriveSpec("B", driveB)));
        when(config.getIndexThreadPoolSize()).thenReturn(2);
        when(config.getSearchThreadPoolSize()).thenReturn(2);
        when(config.getSkipDirectories()).thenReturn(List.of(".git"));
        when(config.getSkipExtensions()).thenReturn(List.of("tmp"));
        when(config.getExcludePatterns()).thenReturn(List.of());
        when(config.isBuildOnStartup()).thenReturn(buildOnStartup);
        when(config.isSnapshotEnabled()).thenReturn(snapshots);
        when(config.getSnapshotPath()).thenReturn(tempDir.resolve("snapshots").toString());
        when(config.isLoadSnapshotOnStartup()).thenReturn(true);
        when(config.getMatchMode()).thenReturn(MatchMode.SIMPLE);
        when(config.getMaxResultsPerDrive()).thenReturn(1000);
        when(config.getBatchSize()).thenReturn(10);
        when(config.getChannelCapacity()).thenReturn(8);
        when(config.getAbandonTimeoutMs()).thenReturn(30_000L);
        when(config.getQueryCacheSize()).thenReturn(16);
        when(config.getTimeZone()).thenReturn(ZoneOffset.UTC);
        return config;
    }

    private List<String> search(final String rawQuery, final SearchScope scope) throws InterruptedException {
        try (final ResultStream stream = engine.compileAndSearch(rawQuery, scope)) {
            return stream.collectAll().stream().map(SearchHit::name).toList();
        }
    }

    @Test
    @DisplayName("Should build all drives on startup and search them")
    void buildOnStartupAndSearch() throws InterruptedException {
        engine = new FileSearchEngine(config(true, false));
        final IndexEventListener listener = mock(IndexEventListener.class);
        engine.addIndexEventListener(listener);

        engine.init();

        verify(listener, timeout(5000)).onRebuildFinished(any());
        assertThat(engine.checkIndexStatus(SearchScope.all()).allReady()).isTrue();
        assertThat(search("file:project !backup", SearchScope.all())).containsExactly("project_report.txt");
        assertThat(search("ext:mp3", SearchScope.all())).containsExactly("song.mp3");
        assertThat(search("notes", SearchScope.all())).isEmpty();
        assertThat(search("music", SearchScope.drive("A"))).isEmpty();
    }

    @Test
    @DisplayName("Should report unbuilt drives until an explicit build")
    void explicitBuild() throws Exception {
        engine = new FileSearchEngine(config(false, false));
        engine.init();

        final IndexStatusReport before = engine.checkIndexStatus(SearchScope.all());
        assertThat(before.readyCount()).isZero();
        assertThat(before.perDrive()).extracting(s -> s.state().phase())
                .containsOnly(IndexState.Phase.NOT_BUILT);
        try (final ResultStream stream = engine.compileAndSearch("song", SearchScope.all())) {
            assertThat(stream.collectAll()).isEmpty();
            assertThat(stream.completion().notReady()).isTrue();
        }

        final BuildSummary summary = engine.buildIndex(SearchScope.drive("B")).get(5, TimeUnit.SECONDS);

        assertThat(summary.builtDrives()).containsExactly("B");
        final IndexStatusReport after = engine.checkIndexStatus(SearchScope.drive("B"));
        assertThat(after.allReady()).isTrue();
        assertThat(after.totalFiles()).isEqualTo(2);
        assertThat(search("song", SearchScope.all())).containsExactly("song.mp3");
    }

    @Test
    @DisplayName("Building an unknown drive should report it as failed")
    void unknownDriveBuild() throws Exception {
        engine = new FileSearchEngine(config(false, false));

        final BuildSummary summary = engine.buildIndex(SearchScope.drive("Z")).get(1, TimeUnit.SECONDS);

        assertThat(summary.success()).isFalse();
        assertThat(summary.failedDrives()).containsExactly("Z");
        assertThat(engine.checkIndexStatus(SearchScope.drive("Z")).totalDrives()).isZero();
    }

    @Test
    @DisplayName("Deltas should be visible to the next search")
    void deltas() throws Exception {
        engine = new FileSearchEngine(config(false, false));
        engine.buildIndex(SearchScope.all()).get(5, TimeUnit.SECONDS);
        final String added = driveA.resolve("projects/project_plan.txt").toString();
        final String removed = driveA.resolve("projects/project_report.txt").toString();

        final DeltaResult result = engine.applyFsPathDelta("A",
                List.of(new FileEntry(added, 100, 1_700_000_000L, false, 0)),
                List.of(removed)).get(5, TimeUnit.SECONDS);

        assertThat(result.applied()).isTrue();
        assertThat(search("file:project !backup", SearchScope.drive("A"))).containsExactly("project_plan.txt");
    }

    @Test
    @DisplayName("A restarted engine should serve searches from snapshots before any build")
    void snapshotsOnRestart() throws Exception {
        engine = new FileSearchEngine(config(false, true));
        engine.buildIndex(SearchScope.all()).get(5, TimeUnit.SECONDS);
        engine.close();

        engine = new FileSearchEngine(config(false, true));
        engine.init();

        assertThat(engine.checkIndexStatus(SearchScope.all()).allReady()).isTrue();
        assertThat(search("song", SearchScope.all())).containsExactly("song.mp3");
    }

    @Test
    @DisplayName("Repeated queries should be served from the query cache")
    void queryCache() {
        engine = new FileSearchEngine(config(false, false));

        engine.compileAndSearch("k1", "ext:txt report", SearchScope.all()).close();
        engine.compileAndSearch("k2", "ext:txt report", SearchScope.all()).close();

        assertThat(engine.queryCompiler().getStats().hitCount()).isEqualTo(1);
    }
}
