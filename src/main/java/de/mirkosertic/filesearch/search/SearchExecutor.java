package de.mirkosertic.filesearch.search;

import de.mirkosertic.filesearch.query.Atom;
import de.mirkosertic.filesearch.query.AtomGroup;
import de.mirkosertic.filesearch.query.FilterContext;
import de.mirkosertic.filesearch.query.Query;
import de.mirkosertic.filesearch.store.DriveStore;
import de.mirkosertic.filesearch.store.IdSets;
import de.mirkosertic.filesearch.store.IndexedFile;
import de.mirkosertic.filesearch.store.MatchMode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Evaluates a compiled query against one published store generation.
 *
 * <p>Keyword groups are evaluated intersect-then-scan: groups resolvable through the trigram index run
 * first and every later group only looks at the ids that survived so far. Excluded atoms and filters are
 * checked per candidate while iterating in id order, so hits arrive in insertion order. At most
 * {@code maxResults} hits are produced per drive, handed out in batches of {@code batchSize}.</p>
 */
public class SearchExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SearchExecutor.class);

    /**
     * Receives the batches of one drive.
     */
    @FunctionalInterface
    public interface BatchSink {

        /**
         * @return false to stop the scan
         */
        boolean accept(ResultBatch batch) throws InterruptedException;
    }

    private final MatchMode matchMode;
    private final int maxResults;
    private final int batchSize;

    public SearchExecutor(final MatchMode matchMode, final int maxResults, final int batchSize) {
        if (maxResults < 1 || batchSize < 1) {
            throw new IllegalArgumentException("maxResults and batchSize must be positive");
        }
        this.matchMode = matchMode;
        this.maxResults = maxResults;
        this.batchSize = batchSize;
    }

    /**
     * Streams the hits of the query on this store into the sink.
     *
     * @return number of hits handed to the sink
     */
    public long execute(final DriveStore store, final Query query, final FilterContext context,
                        final SearchSession session, final BatchSink sink) throws InterruptedException {
        if (session.isCancelled()) {
            return 0;
        }
        final long start = System.currentTimeMillis();
        final Candidates candidates = Candidates.of(store, candidateIds(store, query));
        final Predicate<IndexedFile> filter = query.filters().bind(context);
        final List<AtomMatcher> excluded = matchers(query.excluded());

        List<SearchHit> pending = new ArrayList<>(batchSize);
        int sequence = 0;
        long emitted = 0;
        while (candidates.hasNext() && emitted < maxResults) {
            final int id = candidates.next();
            final IndexedFile file = store.get(id);
            if (file == null || isExcluded(store, id, excluded) || !filter.test(file)) {
                continue;
            }
            pending.add(SearchHit.of(store.drive(), file));
            emitted++;
            if (pending.size() == batchSize) {
                if (!sink.accept(new ResultBatch(session.id(), store.drive(), sequence++, pending))) {
                    return emitted - pending.size();
                }
                pending = new ArrayList<>(batchSize);
                if (session.isCancelled()) {
                    logger.debug("Session {} cancelled while scanning drive '{}'", session.id(), store.drive());
                    return emitted;
                }
            }
        }
        if (!pending.isEmpty() && !sink.accept(new ResultBatch(session.id(), store.drive(), sequence, pending))) {
            emitted -= pending.size();
        }
        logger.debug("Session {} found {} hits on drive '{}' in {}ms", session.id(), emitted, store.drive(),
                System.currentTimeMillis() - start);
        return emitted;
    }

    /**
     * All matching records without cap or batching, in id order.
     */
    public List<IndexedFile> evaluate(final DriveStore store, final Query query, final FilterContext context) {
        final Candidates candidates = Candidates.of(store, candidateIds(store, query));
        final Predicate<IndexedFile> filter = query.filters().bind(context);
        final List<AtomMatcher> excluded = matchers(query.excluded());
        final List<IndexedFile> result = new ArrayList<>();
        while (candidates.hasNext()) {
            final int id = candidates.next();
            final IndexedFile file = store.get(id);
            if (file != null && !isExcluded(store, id, excluded) && filter.test(file)) {
                result.add(file);
            }
        }
        return result;
    }

    /**
     * Ids satisfying all keyword groups, or the extension buckets when there are no groups.
     * {@code null} means every record is a candidate.
     */
    int @Nullable [] candidateIds(final DriveStore store, final Query query) {
        final List<AtomGroup> groups = new ArrayList<>(query.groups());
        groups.sort(Comparator.comparing(group -> !indexed(group)));

        int[] running = null;
        for (final AtomGroup group : groups) {
            int[] matched = IdSets.EMPTY;
            for (final Atom atom : group.alternatives()) {
                matched = IdSets.union(matched, new AtomMatcher(atom, matchMode).select(store, running));
            }
            running = matched;
            if (running.length == 0) {
                return running;
            }
        }
        if (running == null) {
            final Set<String> extensions = query.filters().requiredExtensions();
            if (extensions != null) {
                return store.idsWithExtensions(extensions);
            }
        }
        return running;
    }

    private boolean indexed(final AtomGroup group) {
        for (final Atom atom : group.alternatives()) {
            if (!new AtomMatcher(atom, matchMode).indexed()) {
                return false;
            }
        }
        return true;
    }

    private List<AtomMatcher> matchers(final List<Atom> atoms) {
        return atoms.stream().map(atom -> new AtomMatcher(atom, matchMode)).toList();
    }

    private static boolean isExcluded(final DriveStore store, final int id, final List<AtomMatcher> excluded) {
        for (final AtomMatcher matcher : excluded) {
            if (matcher.matches(store, id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Ascending id cursor over an explicit id set or over every slot.
     */
    private static final class Candidates {

        private final int @Nullable [] ids;
        private final int limit;
        private int position;

        private Candidates(final int @Nullable [] ids, final int limit) {
            this.ids = ids;
            this.limit = limit;
        }

        static Candidates of(final DriveStore store, final int @Nullable [] ids) {
            return new Candidates(ids, ids == null ? store.slotCount() : ids.length);
        }

        boolean hasNext() {
            return position < limit;
        }

        int next() {
            return ids == null ? position++ : ids[position++];
        }
    }
}
