package de.mirkosertic.filesearch.store;

/**
 * Raw filesystem entry as yielded by a drive walker, before it is indexed.
 */
public record FileEntry(
        String fullPath,
        long size,
        /** Seconds since the epoch. */
        long modifiedTime,
        boolean directory,
        /** Bitset of {@link IndexedFile#HIDDEN}, {@link IndexedFile#READ_ONLY}, {@link IndexedFile#SYSTEM}. */
        int attributes
) {
}
