package de.mirkosertic.filesearch.search;

import de.mirkosertic.filesearch.query.Atom;
import de.mirkosertic.filesearch.query.WildcardMatcher;
import de.mirkosertic.filesearch.store.DriveStore;
import de.mirkosertic.filesearch.store.IdSets;
import de.mirkosertic.filesearch.store.MatchMode;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;

/**
 * An atom compiled for one match mode: selects candidates from a store and verifies single records.
 */
final class AtomMatcher {

    private final Atom atom;
    private final MatchMode mode;
    private final @Nullable WildcardMatcher wildcard;

    AtomMatcher(final Atom atom, final MatchMode mode) {
        this.atom = atom;
        this.mode = mode;
        this.wildcard = atom.wildcard() ? new WildcardMatcher(atom.text()) : null;
    }

    /**
     * True if candidates come from the trigram indices. An atom with a path separator can span the
     * boundary between directory and name, so in {@code SIMPLE} mode it has to be scanned.
     */
    boolean indexed() {
        return atom.trigramResolvable() && (mode == MatchMode.RESTRICTED || !atom.containsSeparator());
    }

    boolean matches(final DriveStore store, final int id) {
        if (wildcard != null) {
            return wildcard.matches(store.lowerName(id))
                    || (mode == MatchMode.SIMPLE && wildcard.matches(store.lowerPath(id)));
        }
        return mode == MatchMode.RESTRICTED
                ? store.lowerName(id).contains(atom.text())
                : store.lowerPath(id).contains(atom.text());
    }

    /**
     * Verified ids matching the atom, ascending, limited to {@code restrictTo} unless it is null.
     */
    int[] select(final DriveStore store, final int @Nullable [] restrictTo) {
        if (indexed()) {
            int[] candidates = store.nameTrigramCandidates(atom.text());
            if (mode == MatchMode.SIMPLE) {
                candidates = IdSets.union(candidates, store.directoryChildCandidates(atom.text()));
            }
            if (restrictTo != null) {
                candidates = IdSets.intersect(candidates, restrictTo);
            }
            return verify(store, candidates);
        }
        return restrictTo != null ? verify(store, restrictTo) : scan(store);
    }

    /**
     * Exhaustive scan without any index, for checking the indexed path.
     */
    int[] scan(final DriveStore store) {
        final int[] result = new int[store.liveCount()];
        int n = 0;
        for (int id = 0; id < store.slotCount(); id++) {
            if (store.isLive(id) && matches(store, id)) {
                result[n++] = id;
            }
        }
        return Arrays.copyOf(result, n);
    }

    private int[] verify(final DriveStore store, final int[] candidates) {
        final int[] result = new int[candidates.length];
        int n = 0;
        for (final int id : candidates) {
            if (store.isLive(id) && matches(store, id)) {
                result[n++] = id;
            }
        }
        return n == result.length ? result : Arrays.copyOf(result, n);
    }
}
