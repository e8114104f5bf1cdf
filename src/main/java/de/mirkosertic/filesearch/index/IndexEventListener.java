package de.mirkosertic.filesearch.index;

/**
 * Receives index lifecycle notifications. Callbacks run on index worker threads.
 */
public interface IndexEventListener {

    void onIndexBuilding(String drive);

    void onIndexCompleted(BuildOutcome outcome);

    void onIndexFailed(String drive, String reason);

    void onRebuildFinished(BuildSummary summary);
}
