package de.mirkosertic.filesearch.search;

import de.mirkosertic.filesearch.store.IndexedFile;

public record SearchHit(
        String drive,
        String name,
        String fullPath,
        long size,
        /** Seconds since the epoch. */
        long modifiedTime,
        boolean directory
) {

    public static SearchHit of(final String drive, final IndexedFile file) {
        return new SearchHit(drive, file.name(), file.fullPath(), file.size(), file.modifiedTime(), file.directory());
    }
}
