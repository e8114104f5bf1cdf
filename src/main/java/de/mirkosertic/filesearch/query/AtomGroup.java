package de.mirkosertic.filesearch.query;

import java.util.List;

/**
 * OR-list of atoms. A record matches the group when it matches any alternative.
 */
public record AtomGroup(List<Atom> alternatives) {

    public AtomGroup {
        alternatives = List.copyOf(alternatives);
        if (alternatives.isEmpty()) {
            throw new IllegalArgumentException("An atom group needs at least one alternative");
        }
    }

    public static AtomGroup of(final Atom... atoms) {
        return new AtomGroup(List.of(atoms));
    }
}
