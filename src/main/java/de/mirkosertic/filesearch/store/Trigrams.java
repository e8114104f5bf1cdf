package de.mirkosertic.filesearch.store;

import java.util.LinkedHashSet;
import java.util.Set;

final class Trigrams {

    static final int LENGTH = 3;

    private Trigrams() {
    }

    /**
     * Distinct overlapping 3-character substrings in order of first occurrence.
     */
    static Set<String> of(final String lower) {
        final Set<String> result = new LinkedHashSet<>();
        for (int i = 0; i + LENGTH <= lower.length(); i++) {
            result.add(lower.substring(i, i + LENGTH));
        }
        return result;
    }
}
