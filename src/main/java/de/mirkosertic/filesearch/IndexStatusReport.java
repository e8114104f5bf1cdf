package de.mirkosertic.filesearch;

import de.mirkosertic.filesearch.index.IndexState;

import java.util.List;

/**
 * Index status of the drives in a scope.
 */
public record IndexStatusReport(
        List<DriveStatus> perDrive,
        int readyCount,
        int totalDrives,
        /** Live records over all published generations in scope. */
        long totalFiles
) {

    public IndexStatusReport {
        perDrive = List.copyOf(perDrive);
    }

    public record DriveStatus(
            String drive,
            IndexState state,
            /** Live records of the published generation, 0 if nothing is published. */
            long publishedCount,
            /** Generation searches currently run against, 0 if nothing is published. */
            long publishedGeneration
    ) {
    }

    public boolean allReady() {
        return totalDrives > 0 && readyCount == totalDrives;
    }
}
