package de.mirkosertic.filesearch.config;

import de.mirkosertic.filesearch.index.DriveSpec;
import de.mirkosertic.filesearch.store.MatchMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Central configuration for the file search core.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.filesearch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_DRIVES = "FILESEARCH_DRIVES";
    private static final String ENV_SNAPSHOT_PATH = "FILESEARCH_SNAPSHOT_PATH";
    private static final String PROP_PROFILE = "profile";
    private static final String CONFIG_DIR = ".filesearch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Drives
    private List<DriveSpec> drives = new ArrayList<>();

    // Index settings
    private int indexThreadPoolSize = 2;
    private List<String> skipDirectories = List.of(
            "$recycle.bin", "system volume information", "node_modules", ".git", "__pycache__"
    );
    private List<String> skipExtensions = List.of(
            "tmp", "lock"
    );
    private List<String> excludePatterns = List.of();
    private boolean buildOnStartup = true;
    private boolean snapshotEnabled = false;
    private String snapshotPath;
    private boolean loadSnapshotOnStartup = true;

    // Search settings
    private MatchMode matchMode = MatchMode.SIMPLE;
    private int maxResultsPerDrive = 1000;
    private int batchSize = 100;
    private int channelCapacity = 8;
    private long abandonTimeoutMs = 30000;
    private int searchThreadPoolSize = Math.max(2, Runtime.getRuntime().availableProcessors());
    private int queryCacheSize = 256;
    private ZoneId timeZone = ZoneId.systemDefault();

    // Profile settings
    private boolean deployedMode = false;

    protected ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: drives={}, matchMode={}, snapshotPath={}, deployedMode={}",
                config.drives.size(), config.matchMode, config.snapshotPath, config.deployedMode);

        return config;
    }

    /**
     * Configuration with built-in defaults only, without consulting files or the environment.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.snapshotPath = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "snapshots").toString();
        return config;
    }

    /**
     * Configuration read from a single YAML stream on top of the built-in defaults.
     */
    public static ApplicationConfig fromYaml(final InputStream is) {
        final ApplicationConfig config = defaults();
        final Map<String, Object> yaml = new Yaml().load(is);
        if (yaml != null) {
            config.applyYamlConfig(yaml);
        }
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> rootConfig = (Map<String, Object>) config.get("filesearch");
        if (rootConfig == null) {
            return;
        }

        if (rootConfig.get("drives") instanceof List<?> driveList) {
            this.drives = parseDrives(driveList);
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) rootConfig.get("index");
        if (indexConfig != null) {
            applyIndexConfig(indexConfig);
        }

        final Map<String, Object> searchConfig = (Map<String, Object>) rootConfig.get("search");
        if (searchConfig != null) {
            applySearchConfig(searchConfig);
        }
    }

    @SuppressWarnings("unchecked")
    private List<DriveSpec> parseDrives(final List<?> driveList) {
        final List<DriveSpec> result = new ArrayList<>();
        for (final Object entry : driveList) {
            if (entry instanceof Map<?, ?> map) {
                final Object root = ((Map<String, Object>) map).get("root");
                if (root == null) {
                    logger.warn("Ignoring drive entry without root: {}", map);
                    continue;
                }
                final Object id = ((Map<String, Object>) map).get("id");
                final String resolvedRoot = resolveVariables(root.toString());
                result.add(id != null
                        ? new DriveSpec(id.toString(), Paths.get(resolvedRoot))
                        : DriveSpec.forRoot(Paths.get(resolvedRoot)));
            } else if (entry != null) {
                result.add(DriveSpec.forRoot(Paths.get(resolveVariables(entry.toString()))));
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private void applyIndexConfig(final Map<String, Object> indexConfig) {
        if (indexConfig.containsKey("thread-pool-size")) {
            this.indexThreadPoolSize = ((Number) indexConfig.get("thread-pool-size")).intValue();
        }
        if (indexConfig.get("skip-directories") instanceof List<?> dirs) {
            this.skipDirectories = new ArrayList<>((List<String>) dirs);
        }
        if (indexConfig.get("skip-extensions") instanceof List<?> exts) {
            this.skipExtensions = new ArrayList<>((List<String>) exts);
        }
        if (indexConfig.get("exclude-patterns") instanceof List<?> patterns) {
            this.excludePatterns = new ArrayList<>((List<String>) patterns);
        }
        if (indexConfig.containsKey("build-on-startup")) {
            this.buildOnStartup = (Boolean) indexConfig.get("build-on-startup");
        }
        if (indexConfig.containsKey("snapshot-enabled")) {
            this.snapshotEnabled = (Boolean) indexConfig.get("snapshot-enabled");
        }
        if (indexConfig.containsKey("snapshot-path")) {
            this.snapshotPath = resolveVariables(indexConfig.get("snapshot-path").toString());
        }
        if (indexConfig.containsKey("load-snapshot-on-startup")) {
            this.loadSnapshotOnStartup = (Boolean) indexConfig.get("load-snapshot-on-startup");
        }
    }

    private void applySearchConfig(final Map<String, Object> searchConfig) {
        if (searchConfig.containsKey("match-mode")) {
            final String mode = searchConfig.get("match-mode").toString().trim().toUpperCase(Locale.ROOT);
            try {
                this.matchMode = MatchMode.valueOf(mode);
            } catch (final IllegalArgumentException e) {
                logger.warn("Unknown match-mode '{}', keeping {}", mode, this.matchMode);
            }
        }
        if (searchConfig.containsKey("max-results-per-drive")) {
            this.maxResultsPerDrive = ((Number) searchConfig.get("max-results-per-drive")).intValue();
        }
        if (searchConfig.containsKey("batch-size")) {
            this.batchSize = ((Number) searchConfig.get("batch-size")).intValue();
        }
        if (searchConfig.containsKey("channel-capacity")) {
            this.channelCapacity = ((Number) searchConfig.get("channel-capacity")).intValue();
        }
        if (searchConfig.containsKey("abandon-timeout-ms")) {
            this.abandonTimeoutMs = ((Number) searchConfig.get("abandon-timeout-ms")).longValue();
        }
        if (searchConfig.containsKey("thread-pool-size")) {
            this.searchThreadPoolSize = ((Number) searchConfig.get("thread-pool-size")).intValue();
        }
        if (searchConfig.containsKey("query-cache-size")) {
            this.queryCacheSize = ((Number) searchConfig.get("query-cache-size")).intValue();
        }
        if (searchConfig.containsKey("time-zone")) {
            final String zone = searchConfig.get("time-zone").toString().trim();
            if (!zone.isEmpty() && !"system".equalsIgnoreCase(zone)) {
                try {
                    this.timeZone = ZoneId.of(zone);
                } catch (final DateTimeException e) {
                    logger.warn("Unknown time-zone '{}', keeping {}", zone, this.timeZone);
                }
            }
        }
    }

    private void applyEnvironmentOverrides() {
        // Snapshot path from environment
        final String envSnapshotPath = System.getenv(ENV_SNAPSHOT_PATH);
        if (envSnapshotPath != null && !envSnapshotPath.trim().isEmpty()) {
            this.snapshotPath = envSnapshotPath.trim();
            logger.info("Snapshot path from environment: {}", this.snapshotPath);
        }

        // Default snapshot path if not set
        if (this.snapshotPath == null || this.snapshotPath.isEmpty()) {
            this.snapshotPath = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "snapshots").toString();
        }

        // Drive roots from environment (overrides all other sources)
        final String envDrives = System.getenv(ENV_DRIVES);
        if (envDrives != null && !envDrives.trim().isEmpty()) {
            this.drives = new ArrayList<>();
            for (final String root : envDrives.split(",")) {
                final String trimmed = root.trim();
                if (!trimmed.isEmpty()) {
                    this.drives.add(DriveSpec.forRoot(Paths.get(trimmed)));
                }
            }
            logger.info("Drives from environment: {}", this.drives);
        }

        // System property for snapshot path
        final String propSnapshotPath = System.getProperty("filesearch.snapshot.path");
        if (propSnapshotPath != null && !propSnapshotPath.isEmpty()) {
            this.snapshotPath = propSnapshotPath;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE, "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    // Getters
    public List<DriveSpec> getDrives() {
        return drives;
    }

    public int getIndexThreadPoolSize() {
        return indexThreadPoolSize;
    }

    public List<String> getSkipDirectories() {
        return skipDirectories;
    }

    public List<String> getSkipExtensions() {
        return skipExtensions;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public boolean isBuildOnStartup() {
        return buildOnStartup;
    }

    public boolean isSnapshotEnabled() {
        return snapshotEnabled;
    }

    public String getSnapshotPath() {
        return snapshotPath;
    }

    public boolean isLoadSnapshotOnStartup() {
        return loadSnapshotOnStartup;
    }

    public MatchMode getMatchMode() {
        return matchMode;
    }

    public int getMaxResultsPerDrive() {
        return maxResultsPerDrive;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getChannelCapacity() {
        return channelCapacity;
    }

    public long getAbandonTimeoutMs() {
        return abandonTimeoutMs;
    }

    public int getSearchThreadPoolSize() {
        return searchThreadPoolSize;
    }

    public int getQueryCacheSize() {
        return queryCacheSize;
    }

    public ZoneId getTimeZone() {
        return timeZone;
    }
}
