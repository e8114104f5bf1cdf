package de.mirkosertic.filesearch.index;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One independently indexed root.
 */
public record DriveSpec(String id, Path root) {

    public DriveSpec {
        Objects.requireNonNull(root, "root");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Drive id must not be blank");
        }
    }

    /**
     * Drive whose id is the root path without trailing separators, e.g. {@code C:} for {@code C:\}.
     */
    public static DriveSpec forRoot(final Path root) {
        final String raw = root.toString();
        int end = raw.length();
        while (end > 1 && (raw.charAt(end - 1) == '/' || raw.charAt(end - 1) == '\\')) {
            end--;
        }
        return new DriveSpec(raw.substring(0, end), root);
    }
}
