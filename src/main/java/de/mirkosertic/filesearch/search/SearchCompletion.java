package de.mirkosertic.filesearch.search;

import java.util.Map;

/**
 * Final marker of a search.
 */
public record SearchCompletion(
        long sessionId,
        long totalCount,
        Map<String, DriveSearchStatus> driveStatuses,
        boolean superseded,
        long elapsedMs
) {

    public SearchCompletion {
        driveStatuses = Map.copyOf(driveStatuses);
    }

    /**
     * True if no drive in scope had anything published.
     */
    public boolean notReady() {
        return !driveStatuses.isEmpty()
                && driveStatuses.values().stream().allMatch(s -> s == DriveSearchStatus.NOT_READY);
    }
}
