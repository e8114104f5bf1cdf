package de.mirkosertic.filesearch.query;

import de.mirkosertic.filesearch.store.IndexedFile;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Filters ANDed together.
 */
public record FilterSet(List<Filter> filters) {

    public static final FilterSet EMPTY = new FilterSet(List.of());

    public FilterSet {
        filters = List.copyOf(filters);
    }

    public boolean isEmpty() {
        return filters.isEmpty();
    }

    public Predicate<IndexedFile> bind(final FilterContext context) {
        if (filters.isEmpty()) {
            return file -> true;
        }
        final List<Predicate<IndexedFile>> bound = filters.stream().map(f -> f.bind(context)).toList();
        return file -> {
            for (final Predicate<IndexedFile> predicate : bound) {
                if (!predicate.test(file)) {
                    return false;
                }
            }
            return true;
        };
    }

    /**
     * Extensions every match must have, taken from the first non-negated extension filter,
     * or {@code null} when the set does not constrain extensions.
     */
    public @Nullable Set<String> requiredExtensions() {
        for (final Filter filter : filters) {
            if (filter instanceof Filter.Extension extension) {
                return extension.extensions();
            }
        }
        return null;
    }
}
