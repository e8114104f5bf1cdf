package de.mirkosertic.filesearch.query;

import java.util.List;

/**
 * Compiled form of a raw query string: an AND-list of OR-groups, excluded atoms and filters.
 * Instances are immutable and compare by value.
 */
public record Query(List<AtomGroup> groups, List<Atom> excluded, FilterSet filters) {

    public static final Query EMPTY = new Query(List.of(), List.of(), FilterSet.EMPTY);

    public Query {
        groups = List.copyOf(groups);
        excluded = List.copyOf(excluded);
    }

    public boolean isEmpty() {
        return groups.isEmpty() && excluded.isEmpty() && filters.isEmpty();
    }
}
