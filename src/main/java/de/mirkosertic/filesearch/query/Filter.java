package de.mirkosertic.filesearch.query;

import de.mirkosertic.filesearch.store.IndexedFile;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Closed set of record filters. A filter is bound to a {@link FilterContext} once per search,
 * which resolves symbolic values such as relative dates.
 */
public sealed interface Filter permits Filter.Extension, Filter.Size, Filter.Modified, Filter.PathLength,
        Filter.Attributes, Filter.PathContains, Filter.Kind, Filter.Negated {

    Predicate<IndexedFile> bind(FilterContext context);

    /**
     * Lowercase extensions without the dot, any-of. Directories never match.
     */
    record Extension(Set<String> extensions) implements Filter {

        public Extension {
            extensions = Set.copyOf(extensions);
        }

        @Override
        public Predicate<IndexedFile> bind(final FilterContext context) {
            return file -> !file.directory() && extensions.contains(file.extension());
        }
    }

    record Size(List<LongRange> ranges) implements Filter {

        public Size {
            ranges = List.copyOf(ranges);
        }

        @Override
        public Predicate<IndexedFile> bind(final FilterContext context) {
            return file -> anyContains(ranges, file.size());
        }
    }

    record Modified(List<DateCondition> conditions) implements Filter {

        public Modified {
            conditions = List.copyOf(conditions);
        }

        @Override
        public Predicate<IndexedFile> bind(final FilterContext context) {
            final List<LongRange> resolved = conditions.stream()
                    .map(c -> c.resolve(context))
                    .toList();
            return file -> anyContains(resolved, file.modifiedTime());
        }
    }

    /**
     * Length of the full path in characters.
     */
    record PathLength(List<LongRange> ranges) implements Filter {

        public PathLength {
            ranges = List.copyOf(ranges);
        }

        @Override
        public Predicate<IndexedFile> bind(final FilterContext context) {
            return file -> anyContains(ranges, file.fullPath().length());
        }
    }

    /**
     * Any-of attribute masks, each mask requiring all of its bits.
     */
    record Attributes(List<Integer> masks) implements Filter {

        public Attributes {
            masks = List.copyOf(masks);
        }

        @Override
        public Predicate<IndexedFile> bind(final FilterContext context) {
            return file -> {
                for (final int mask : masks) {
                    if (file.hasAttributes(mask)) {
                        return true;
                    }
                }
                return false;
            };
        }
    }

    record PathContains(List<String> fragments) implements Filter {

        public PathContains {
            fragments = fragments.stream().map(f -> f.toLowerCase(Locale.ROOT)).toList();
        }

        @Override
        public Predicate<IndexedFile> bind(final FilterContext context) {
            return file -> {
                final String path = file.fullPath().toLowerCase(Locale.ROOT);
                for (final String fragment : fragments) {
                    if (path.contains(fragment)) {
                        return true;
                    }
                }
                return false;
            };
        }
    }

    record Kind(Target target) implements Filter {

        public enum Target {
            FILES, FOLDERS
        }

        @Override
        public Predicate<IndexedFile> bind(final FilterContext context) {
            return target == Target.FOLDERS ? IndexedFile::directory : file -> !file.directory();
        }
    }

    record Negated(Filter filter) implements Filter {

        @Override
        public Predicate<IndexedFile> bind(final FilterContext context) {
            return filter.bind(context).negate();
        }
    }

    private static boolean anyContains(final List<LongRange> ranges, final long value) {
        for (final LongRange range : ranges) {
            if (range.contains(value)) {
                return true;
            }
        }
        return false;
    }
}
