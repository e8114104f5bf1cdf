package de.mirkosertic.filesearch.index;

import org.jspecify.annotations.Nullable;

/**
 * Result of one build of one drive.
 */
public record BuildOutcome(
        String drive,
        boolean success,
        long count,
        long generationId,
        long durationMs,
        @Nullable String reason
) {

    public static BuildOutcome success(final String drive, final long count, final long generationId,
                                       final long durationMs) {
        return new BuildOutcome(drive, true, count, generationId, durationMs, null);
    }

    public static BuildOutcome failure(final String drive, final String reason, final long durationMs) {
        return new BuildOutcome(drive, false, 0, 0, durationMs, reason);
    }
}
