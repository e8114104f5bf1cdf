package de.mirkosertic.filesearch;

import de.mirkosertic.filesearch.config.ApplicationConfig;
import de.mirkosertic.filesearch.config.BuildInfo;
import de.mirkosertic.filesearch.config.LoggingConfigurator;
import de.mirkosertic.filesearch.index.BuildOutcome;
import de.mirkosertic.filesearch.index.BuildSummary;
import de.mirkosertic.filesearch.index.IndexEventListener;
import de.mirkosertic.filesearch.search.ResultBatch;
import de.mirkosertic.filesearch.search.ResultStream;
import de.mirkosertic.filesearch.search.SearchCompletion;
import de.mirkosertic.filesearch.search.SearchHit;
import de.mirkosertic.filesearch.search.SearchScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Console runner: reads one query per line from stdin and prints the hits.
 * <p>
 * Lines starting with {@code :} are commands: {@code :status}, {@code :rebuild [drive]},
 * {@code :drive <id|all>} to change the scope, and {@code :quit}.
 */
public class FileSearchApplication {

    private static final Logger logger = LoggerFactory.getLogger(FileSearchApplication.class);

    private final FileSearchEngine engine;
    private final PrintStream out;
    private SearchScope scope = SearchScope.all();

    public FileSearchApplication(final FileSearchEngine engine, final PrintStream out) {
        this.engine = engine;
        this.out = out;
    }

    /**
     * Initialize the engine and report index progress on the console.
     */
    public void init() {
        engine.addIndexEventListener(new IndexEventListener() {
            @Override
            public void onIndexBuilding(final String drive) {
                out.println("[index] building " + drive);
            }

            @Override
            public void onIndexCompleted(final BuildOutcome outcome) {
                out.println("[index] " + outcome.drive() + " ready with " + outcome.count() + " entries");
            }

            @Override
            public void onIndexFailed(final String drive, final String reason) {
                out.println("[index] " + drive + " failed: " + reason);
            }

            @Override
            public void onRebuildFinished(final BuildSummary summary) {
                out.println("[index] " + summary.message());
            }
        });
        engine.init();
    }

    /**
     * Process input lines until end of input or {@code :quit}.
     */
    public void run(final BufferedReader in) throws IOException, InterruptedException {
        String line;
        while ((line = in.readLine()) != null) {
            final String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.startsWith(":")) {
                if (!command(trimmed)) {
                    return;
                }
                continue;
            }
            search(trimmed);
        }
    }

    private boolean command(final String line) {
        final String[] parts = line.substring(1).split("\\s+", 2);
        final String argument = parts.length > 1 ? parts[1].trim() : "";
        switch (parts[0]) {
            case "quit", "q" -> {
                return false;
            }
            case "status" -> {
                final IndexStatusReport report = engine.checkIndexStatus(scope);
                for (final IndexStatusReport.DriveStatus status : report.perDrive()) {
                    out.println(status.drive() + ": " + status.state().phase() + " (" + status.publishedCount() + " entries)");
                }
                out.println(report.readyCount() + "/" + report.totalDrives() + " ready, " + report.totalFiles() + " entries");
            }
            case "rebuild" -> engine.buildIndex(SearchScope.parse(argument.isEmpty() ? null : argument));
            case "drive" -> {
                scope = SearchScope.parse(argument);
                out.println("Scope: " + (scope.isAll() ? "all drives" : scope.drive()));
            }
            default -> out.println("Unknown command: " + parts[0]);
        }
        return true;
    }

    private void search(final String rawQuery) throws InterruptedException {
        try (final ResultStream stream = engine.compileAndSearch("console", rawQuery, scope)) {
            ResultBatch batch;
            while ((batch = stream.nextBatch()) != null) {
                for (final SearchHit hit : batch.hits()) {
                    out.println((hit.directory() ? "[dir] " : "      ") + hit.fullPath());
                }
            }
            final SearchCompletion completion = stream.completion();
            if (completion.notReady()) {
                out.println("Index not ready yet");
            } else {
                out.println(completion.totalCount() + " hit(s) in " + completion.elapsedMs() + "ms");
            }
        }
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = "deployed".equalsIgnoreCase(System.getProperty("profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            logger.info("File search {} (built {})", BuildInfo.getVersion(), BuildInfo.getBuildTimestamp());
            if (config.getDrives().isEmpty()) {
                logger.warn("No drives configured; set filesearch.drives or FILESEARCH_DRIVES");
            }

            final FileSearchEngine engine = new FileSearchEngine(config);
            Runtime.getRuntime().addShutdownHook(new Thread(engine::close, "shutdown-hook"));

            final FileSearchApplication app = new FileSearchApplication(engine, System.out);
            app.init();
            app.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));

            engine.close();
            logger.info("File search finished.");
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (final Exception e) {
            System.err.println("Failed to start file search: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
