package de.mirkosertic.filesearch.search;

import de.mirkosertic.filesearch.index.IndexState;

/**
 * How a drive took part in a search.
 */
public enum DriveSearchStatus {
    /** Searched against a current generation. */
    READY,
    /** Searched against the prior generation while a rebuild runs. */
    BUILDING,
    /** Searched against the prior generation after the last build failed, or the scan itself failed. */
    FAILED,
    /** Nothing published, not searched. */
    NOT_READY;

    static DriveSearchStatus of(final IndexState state, final boolean published) {
        if (!published) {
            return NOT_READY;
        }
        return switch (state.phase()) {
            case READY, NOT_BUILT -> READY;
            case BUILDING -> BUILDING;
            case FAILED -> FAILED;
        };
    }
}
