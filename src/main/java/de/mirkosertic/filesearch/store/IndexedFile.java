package de.mirkosertic.filesearch.store;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable snapshot of one filesystem entry at index time.
 */
public record IndexedFile(
        String name,
        String fullPath,
        long size,
        /** Seconds since the epoch. */
        long modifiedTime,
        boolean directory,
        /** Lowercase extension without the dot, empty for directories and names without one. */
        String extension,
        int attributes
) {

    public static final int HIDDEN = 1;
    public static final int READ_ONLY = 1 << 1;
    public static final int SYSTEM = 1 << 2;

    public IndexedFile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fullPath, "fullPath");
        extension = extension == null ? "" : extension;
    }

    public static IndexedFile of(final String fullPath, final long size, final long modifiedTime,
                                 final boolean directory, final int attributes) {
        final String path = normalizePath(fullPath);
        final String name = nameOf(path);
        return new IndexedFile(name, path, size, modifiedTime, directory,
                extensionOf(name, directory), attributes);
    }

    public static IndexedFile fromEntry(final FileEntry entry) {
        return of(entry.fullPath(), entry.size(), entry.modifiedTime(), entry.directory(), entry.attributes());
    }

    /**
     * Last path segment, accepting both separator styles so that Windows paths index
     * the same way on any host.
     */
    static String nameOf(final String fullPath) {
        int end = fullPath.length();
        while (end > 1 && isSeparator(fullPath.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && !isSeparator(fullPath.charAt(start - 1))) {
            start--;
        }
        return start == end ? fullPath : fullPath.substring(start, end);
    }

    /**
     * Drops trailing separators. Roots such as {@code /} and {@code C:\} are kept as they are.
     */
    public static String normalizePath(final String fullPath) {
        int end = fullPath.length();
        while (end > 1 && isSeparator(fullPath.charAt(end - 1)) && !isDriveRoot(fullPath, end)) {
            end--;
        }
        return fullPath.substring(0, end);
    }

    private static boolean isDriveRoot(final String fullPath, final int end) {
        return end == 3 && fullPath.charAt(1) == ':';
    }

    static String extensionOf(final String name, final boolean directory) {
        if (directory) {
            return "";
        }
        final int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static boolean isSeparator(final char c) {
        return c == '/' || c == '\\';
    }

    public boolean hasAttributes(final int mask) {
        return (attributes & mask) == mask;
    }

    /**
     * Full path of the containing directory without a trailing separator, empty for a root.
     */
    public String parentPath() {
        int end = fullPath.length() - name.length();
        if (end <= 0 || !fullPath.endsWith(name)) {
            return "";
        }
        while (end > 0 && isSeparator(fullPath.charAt(end - 1))) {
            end--;
        }
        return fullPath.substring(0, end);
    }
}
