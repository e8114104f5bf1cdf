package de.mirkosertic.filesearch.index;

import org.jspecify.annotations.Nullable;

/**
 * Index state of one drive.
 * <p>
 * Allowed transitions: {@code NOT_BUILT -> BUILDING}, {@code BUILDING -> READY | FAILED},
 * {@code READY -> BUILDING} and {@code FAILED -> BUILDING}.
 */
public record IndexState(
        Phase phase,
        /** Live records of the published generation, only meaningful when {@code READY}. */
        long count,
        long generationId,
        /** Failure reason, only set when {@code FAILED}. */
        @Nullable String reason
) {

    public enum Phase {
        NOT_BUILT, BUILDING, READY, FAILED
    }

    private static final IndexState NOT_BUILT = new IndexState(Phase.NOT_BUILT, 0, 0, null);
    private static final IndexState BUILDING = new IndexState(Phase.BUILDING, 0, 0, null);

    public static IndexState notBuilt() {
        return NOT_BUILT;
    }

    public static IndexState building() {
        return BUILDING;
    }

    public static IndexState ready(final long count, final long generationId) {
        return new IndexState(Phase.READY, count, generationId, null);
    }

    public static IndexState failed(final String reason) {
        return new IndexState(Phase.FAILED, 0, 0, reason);
    }

    public boolean canTransitionTo(final Phase next) {
        return switch (phase) {
            case NOT_BUILT, READY, FAILED -> next == Phase.BUILDING;
            case BUILDING -> next == Phase.READY || next == Phase.FAILED;
        };
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public IndexState transitionTo(final IndexState next) {
        if (!canTransitionTo(next.phase())) {
            throw new IllegalStateException("Invalid index state transition " + phase + " -> " + next.phase());
        }
        return next;
    }
}
