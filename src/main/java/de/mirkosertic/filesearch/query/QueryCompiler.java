package de.mirkosertic.filesearch.query;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import de.mirkosertic.filesearch.store.IndexedFile;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles free-text search strings into immutable {@link Query} values.
 *
 * <p>Syntax overview:</p>
 * <ul>
 *   <li>Whitespace separates AND terms, double quotes group whitespace into one term</li>
 *   <li>{@code a|b} is an OR-group, a leading {@code !} excludes the term</li>
 *   <li>{@code ext:}, {@code size:}, {@code dm:}/{@code datemodified:}, {@code len:}, {@code attrib:},
 *       {@code path:}, {@code file:} and {@code folder:} are filters; {@code key:v1|v2} is any-of</li>
 *   <li>{@code *} and {@code ?} make a wildcard atom matching the whole name</li>
 * </ul>
 *
 * <p>Compilation never fails. Unknown keys are kept as literal keywords and a term with a malformed
 * filter value degrades to a literal atom of the whole term. Results are cached by raw string.</p>
 */
public class QueryCompiler {

    private static final Logger logger = LoggerFactory.getLogger(QueryCompiler.class);

    private static final Set<String> FILTER_KEYS = Set.of(
            "ext", "size", "dm", "datemodified", "len", "attrib", "path", "file", "folder");

    private static final Pattern SIZE_VALUE = Pattern.compile("(\\d+(?:\\.\\d+)?)(b|kb|mb|gb)?");
    private static final Pattern COUNT_VALUE = Pattern.compile("\\d{1,18}");

    private final Cache<String, Query> cache;

    public QueryCompiler(final int cacheSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, cacheSize))
                .recordStats()
                .build();
    }

    public Query compile(final @Nullable String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return Query.EMPTY;
        }
        return cache.get(rawQuery, QueryCompiler::parse);
    }

    public CacheStats getStats() {
        return cache.stats();
    }

    /**
     * Uncached compilation.
     */
    public static Query parse(final String rawQuery) {
        final QueryParts parts = new QueryParts();
        for (final String term : tokenize(rawQuery)) {
            compileTerm(term, parts);
        }
        final Query query = parts.toQuery();
        logger.debug("Compiled '{}' into {}", rawQuery, query);
        return query;
    }

    static List<String> tokenize(final String rawQuery) {
        final List<String> terms = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < rawQuery.length(); i++) {
            final char c = rawQuery.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (!inQuotes && Character.isWhitespace(c)) {
                if (!current.isEmpty()) {
                    terms.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (!current.isEmpty()) {
            terms.add(current.toString());
        }
        return terms;
    }

    private static void compileTerm(final String term, final QueryParts parts) {
        final boolean negated = term.length() > 1 && term.charAt(0) == '!';
        final String body = negated ? term.substring(1) : term;

        final int colon = body.indexOf(':');
        if (colon > 0) {
            final String key = body.substring(0, colon).toLowerCase(Locale.ROOT);
            if (FILTER_KEYS.contains(key)) {
                if (!compileFilter(key, body.substring(colon + 1), negated, parts)) {
                    logger.debug("Malformed filter term '{}', searching it as a literal", term);
                    parts.keywords(List.of(Atom.of(body)), negated);
                }
                return;
            }
        }
        compileKeywords(body, negated, parts);
    }

    private static void compileKeywords(final String body, final boolean negated, final QueryParts parts) {
        final List<Atom> atoms = new ArrayList<>();
        for (final String alternative : body.split("\\|")) {
            if (!alternative.isEmpty()) {
                atoms.add(Atom.of(alternative));
            }
        }
        if (atoms.isEmpty()) {
            atoms.add(Atom.of(body));
        }
        parts.keywords(atoms, negated);
    }

    /**
     * @return false if the value is malformed for the key
     */
    private static boolean compileFilter(final String key, final String value, final boolean negated,
                                         final QueryParts parts) {
        final Filter filter = switch (key) {
            case "ext" -> extensionFilter(value);
            case "size" -> {
                final List<LongRange> ranges = parseAll(value, v -> parseRange(v, QueryCompiler::parseSize));
                yield ranges == null ? null : new Filter.Size(ranges);
            }
            case "len" -> {
                final List<LongRange> ranges = parseAll(value, v -> parseRange(v, QueryCompiler::parseCount));
                yield ranges == null ? null : new Filter.PathLength(ranges);
            }
            case "dm", "datemodified" -> {
                final List<DateCondition> conditions = parseAll(value, QueryCompiler::parseDateCondition);
                yield conditions == null ? null : new Filter.Modified(conditions);
            }
            case "attrib" -> {
                final List<Integer> masks = parseAll(value, QueryCompiler::parseAttributeMask);
                yield masks == null ? null : new Filter.Attributes(masks);
            }
            case "path" -> {
                final List<String> fragments = parseAll(value, v -> v);
                yield fragments == null ? null : new Filter.PathContains(fragments);
            }
            case "file", "folder" -> {
                if (!value.isEmpty()) {
                    compileKeywords(value, negated, parts);
                }
                yield new Filter.Kind("file".equals(key) ? Filter.Kind.Target.FILES : Filter.Kind.Target.FOLDERS);
            }
            default -> null;
        };
        if (filter == null) {
            return false;
        }
        parts.filter(negated ? new Filter.Negated(filter) : filter);
        return true;
    }

    private static @Nullable Filter extensionFilter(final String value) {
        final Set<String> extensions = new LinkedHashSet<>();
        for (final String part : value.split("[|,;]")) {
            String ext = part.trim().toLowerCase(Locale.ROOT);
            while (ext.startsWith(".")) {
                ext = ext.substring(1);
            }
            if (!ext.isEmpty()) {
                extensions.add(ext);
            }
        }
        return extensions.isEmpty() ? null : new Filter.Extension(extensions);
    }

    /**
     * Parses every {@code |}-separated value, or returns null if any of them is malformed or none is given.
     */
    private static <T> @Nullable List<T> parseAll(final String value, final Function<String, @Nullable T> parser) {
        final List<T> result = new ArrayList<>();
        for (final String part : value.split("\\|")) {
            if (part.isEmpty()) {
                continue;
            }
            final T parsed = parser.apply(part);
            if (parsed == null) {
                return null;
            }
            result.add(parsed);
        }
        return result.isEmpty() ? null : result;
    }

    static @Nullable LongRange parseRange(final String value, final Function<String, @Nullable Long> parser) {
        final int dots = value.indexOf("..");
        if (dots >= 0) {
            final String lower = value.substring(0, dots);
            final String upper = value.substring(dots + 2);
            if (lower.isEmpty() && upper.isEmpty()) {
                return null;
            }
            final Long min = lower.isEmpty() ? Long.valueOf(Long.MIN_VALUE) : parser.apply(lower);
            final Long max = upper.isEmpty() ? Long.valueOf(Long.MAX_VALUE) : parser.apply(upper);
            if (min == null || max == null) {
                return null;
            }
            return new LongRange(min, max);
        }
        final Operand operand = Operand.split(value);
        final Long parsed = parser.apply(operand.value());
        return parsed == null ? null : LongRange.compare(operand.comparison(), parsed);
    }

    static @Nullable Long parseSize(final String value) {
        final Matcher m = SIZE_VALUE.matcher(value.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            return null;
        }
        final String unit = m.group(2) == null ? "b" : m.group(2);
        final long multiplier = switch (unit) {
            case "kb" -> 1024L;
            case "mb" -> 1024L * 1024L;
            case "gb" -> 1024L * 1024L * 1024L;
            default -> 1L;
        };
        try {
            return new BigDecimal(m.group(1))
                    .multiply(BigDecimal.valueOf(multiplier))
                    .setScale(0, RoundingMode.FLOOR)
                    .longValueExact();
        } catch (final ArithmeticException e) {
            return null;
        }
    }

    private static @Nullable Long parseCount(final String value) {
        final String v = value.trim();
        return COUNT_VALUE.matcher(v).matches() ? Long.valueOf(v) : null;
    }

    private static @Nullable DateCondition parseDateCondition(final String value) {
        final int dots = value.indexOf("..");
        if (dots >= 0) {
            final DateExpression from = DateExpression.parse(value.substring(0, dots));
            final DateExpression to = DateExpression.parse(value.substring(dots + 2));
            return from == null || to == null ? null : DateCondition.between(from, to);
        }
        final Operand operand = Operand.split(value);
        final DateExpression expression = DateExpression.parse(operand.value());
        return expression == null ? null : DateCondition.of(operand.comparison(), expression);
    }

    /**
     * Letters of one value are required together: {@code hr} means hidden and read-only.
     */
    private static @Nullable Integer parseAttributeMask(final String value) {
        int mask = 0;
        for (final char c : value.toLowerCase(Locale.ROOT).toCharArray()) {
            switch (c) {
                case 'h' -> mask |= IndexedFile.HIDDEN;
                case 'r' -> mask |= IndexedFile.READ_ONLY;
                case 's' -> mask |= IndexedFile.SYSTEM;
                default -> {
                    return null;
                }
            }
        }
        return mask == 0 ? null : mask;
    }

    private record Operand(Comparison comparison, String value) {

        static Operand split(final String raw) {
            if (raw.startsWith(">=")) {
                return new Operand(Comparison.GE, raw.substring(2));
            }
            if (raw.startsWith("<=")) {
                return new Operand(Comparison.LE, raw.substring(2));
            }
            if (raw.startsWith(">")) {
                return new Operand(Comparison.GT, raw.substring(1));
            }
            if (raw.startsWith("<")) {
                return new Operand(Comparison.LT, raw.substring(1));
            }
            if (raw.startsWith("=")) {
                return new Operand(Comparison.EQ, raw.substring(1));
            }
            return new Operand(Comparison.EQ, raw);
        }
    }

    private static final class QueryParts {

        private final List<AtomGroup> groups = new ArrayList<>();
        private final List<Atom> excluded = new ArrayList<>();
        private final List<Filter> filters = new ArrayList<>();

        void keywords(final List<Atom> atoms, final boolean negated) {
            if (negated) {
                excluded.addAll(atoms);
            } else {
                groups.add(new AtomGroup(atoms));
            }
        }

        void filter(final Filter filter) {
            filters.add(filter);
        }

        Query toQuery() {
            return new Query(groups, excluded, new FilterSet(filters));
        }
    }
}
