package de.mirkosertic.filesearch.index;

/**
 * Outcome of an incremental update. {@code applied} is false when the drive had nothing published.
 */
public record DeltaResult(String drive, boolean applied, int added, int removed, long liveCount) {

    public static DeltaResult notApplied(final String drive) {
        return new DeltaResult(drive, false, 0, 0, 0);
    }
}
