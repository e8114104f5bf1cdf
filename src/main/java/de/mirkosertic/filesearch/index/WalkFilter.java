package de.mirkosertic.filesearch.index;

import de.mirkosertic.filesearch.config.ApplicationConfig;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which directories a walk descends into and which entries it yields.
 * Directory and extension names are compared case-insensitively; exclude patterns are globs
 * matched against the full path and against the file name.
 */
public class WalkFilter {

    private final Set<String> skipDirectories;
    private final Set<String> skipExtensions;
    private final List<PathMatcher> excludeMatchers;

    public WalkFilter(final List<String> skipDirectories, final List<String> skipExtensions,
                      final List<String> excludePatterns) {
        this.skipDirectories = skipDirectories.stream()
                .map(d -> d.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.skipExtensions = skipExtensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .map(e -> e.startsWith(".") ? e.substring(1) : e)
                .collect(Collectors.toUnmodifiableSet());
        this.excludeMatchers = excludePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    public static WalkFilter from(final ApplicationConfig config) {
        return new WalkFilter(config.getSkipDirectories(), config.getSkipExtensions(), config.getExcludePatterns());
    }

    public static WalkFilter acceptAll() {
        return new WalkFilter(List.of(), List.of(), List.of());
    }

    public boolean shouldDescend(final Path directory) {
        final Path name = directory.getFileName();
        if (name != null && skipDirectories.contains(name.toString().toLowerCase(Locale.ROOT))) {
            return false;
        }
        return !isExcluded(directory);
    }

    public boolean shouldInclude(final Path file) {
        final Path name = file.getFileName();
        if (name != null) {
            final String lower = name.toString().toLowerCase(Locale.ROOT);
            final int dot = lower.lastIndexOf('.');
            if (dot > 0 && skipExtensions.contains(lower.substring(dot + 1))) {
                return false;
            }
        }
        return !isExcluded(file);
    }

    private boolean isExcluded(final Path path) {
        final Path name = path.getFileName();
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(path) || (name != null && excludeMatcher.matches(name))) {
                return true;
            }
        }
        return false;
    }
}
