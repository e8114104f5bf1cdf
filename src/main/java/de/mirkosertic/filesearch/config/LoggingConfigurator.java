package de.mirkosertic.filesearch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.jspecify.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configures logging based on the active profile.
 * <p>
 * In deployed mode, loads logback-deployed.xml which writes to a rolling file so that console
 * output stays reserved for search results. The log directory defaults to ~/.filesearch/log and
 * can be moved with {@code -Dfilesearch.log.dir}.
 * <p>
 * In default mode (development), uses logback.xml with console output.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "filesearch.log.dir";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Configure logging based on the active profile.
     * Must be called early in application startup, before logging is used.
     *
     * @param deployedMode true if running in deployed mode
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            configureDeployed(logDirectory());
        }
        // Default mode uses logback.xml which is loaded automatically
    }

    static Path logDirectory() {
        final String configured = System.getProperty(LOG_DIR_PROPERTY);
        return configured == null || configured.isBlank()
                ? Paths.get(System.getProperty("user.home"), ".filesearch", "log")
                : Paths.get(configured);
    }

    /**
     * @return false if the directory could not be created or the configuration did not load;
     *         logback then keeps its current configuration
     */
    static boolean configureDeployed(final Path logDirectory) {
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
            return false;
        }
        return load(DEPLOYED_CONFIG, logDirectory);
    }

    /**
     * Replaces the logback configuration with the given classpath resource. {@code LOG_DIR} is
     * available to the resource when a log directory is passed.
     */
    static boolean load(final String resource, final @Nullable Path logDirectory) {
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(resource)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + resource + " on classpath");
                return false;
            }
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();
            if (logDirectory != null) {
                context.putProperty("LOG_DIR", logDirectory.toString());
            }
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
            return true;
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + resource + ": " + e.getMessage());
            return false;
        }
    }
}
