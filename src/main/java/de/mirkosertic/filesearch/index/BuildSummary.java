package de.mirkosertic.filesearch.index;

import java.util.List;

/**
 * Aggregate result of building several drives.
 */
public record BuildSummary(List<String> builtDrives, List<String> failedDrives) {

    public BuildSummary {
        builtDrives = List.copyOf(builtDrives);
        failedDrives = List.copyOf(failedDrives);
    }

    public boolean success() {
        return failedDrives.isEmpty();
    }

    public String message() {
        if (failedDrives.isEmpty()) {
            return "Built " + builtDrives.size() + " drive(s)";
        }
        return "Built " + builtDrives.size() + " drive(s), failed: " + String.join(", ", failedDrives);
    }
}
