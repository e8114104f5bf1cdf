package de.mirkosertic.filesearch.store;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One generation of a drive's metadata: the records and their lookup structures.
 * <p>
 * Instances are produced by a {@link DriveStoreBuilder} and never change afterwards, so a published
 * store can be read from any thread without locking. Record ids are slot indices and are only
 * stable within one generation. Removed records leave a {@code null} slot behind.
 */
public final class DriveStore {

    private final String drive;
    private final long generation;
    private final List<@Nullable IndexedFile> records;
    private final List<String> lowerNames;
    private final List<String> lowerPaths;
    private final Map<String, PostingList> nameIndex;
    private final Map<String, PostingList> extensionIndex;
    private final Map<String, PostingList> trigramIndex;
    private final Map<String, PostingList> directoryIndex;
    private final Map<String, Set<String>> directoryTrigramIndex;
    private final int liveCount;

    DriveStore(final String drive,
               final long generation,
               final List<@Nullable IndexedFile> records,
               final List<String> lowerNames,
               final List<String> lowerPaths,
               final Map<String, PostingList> nameIndex,
               final Map<String, PostingList> extensionIndex,
               final Map<String, PostingList> trigramIndex,
               final Map<String, PostingList> directoryIndex,
               final Map<String, Set<String>> directoryTrigramIndex,
               final int liveCount) {
        this.drive = drive;
        this.generation = generation;
        this.records = records;
        this.lowerNames = lowerNames;
        this.lowerPaths = lowerPaths;
        this.nameIndex = nameIndex;
        this.extensionIndex = extensionIndex;
        this.trigramIndex = trigramIndex;
        this.directoryIndex = directoryIndex;
        this.directoryTrigramIndex = directoryTrigramIndex;
        this.liveCount = liveCount;
    }

    public String drive() {
        return drive;
    }

    public long generation() {
        return generation;
    }

    /**
     * Number of slots including tombstones; valid ids are {@code 0 .. slotCount() - 1}.
     */
    public int slotCount() {
        return records.size();
    }

    public int liveCount() {
        return liveCount;
    }

    public @Nullable IndexedFile get(final int id) {
        return id >= 0 && id < records.size() ? records.get(id) : null;
    }

    public boolean isLive(final int id) {
        return get(id) != null;
    }

    public String lowerName(final int id) {
        return lowerNames.get(id);
    }

    public String lowerPath(final int id) {
        return lowerPaths.get(id);
    }

    /**
     * Ids whose name contains every trigram of the literal. Callers still have to verify containment.
     */
    public int[] nameTrigramCandidates(final String lowerLiteral) {
        final List<PostingList> buckets = new ArrayList<>();
        for (final String trigram : Trigrams.of(lowerLiteral)) {
            final PostingList bucket = trigramIndex.get(trigram);
            if (bucket == null) {
                return IdSets.EMPTY;
            }
            buckets.add(bucket);
        }
        return IdSets.intersectAll(buckets);
    }

    /**
     * Ids of all records whose parent directory path contains the literal.
     */
    public int[] directoryChildCandidates(final String lowerLiteral) {
        final Set<String> trigrams = Trigrams.of(lowerLiteral);
        Set<String> smallest = null;
        for (final String trigram : trigrams) {
            final Set<String> directories = directoryTrigramIndex.get(trigram);
            if (directories == null) {
                return IdSets.EMPTY;
            }
            if (smallest == null || directories.size() < smallest.size()) {
                smallest = directories;
            }
        }
        final Collection<String> directories = smallest == null ? directoryIndex.keySet() : smallest;
        int[] result = IdSets.EMPTY;
        for (final String directory : directories) {
            if (directory.contains(lowerLiteral)) {
                final PostingList children = directoryIndex.get(directory);
                if (children != null) {
                    result = IdSets.union(result, children.toArray());
                }
            }
        }
        return result;
    }

    public int[] idsWithExtensions(final Collection<String> extensions) {
        int[] result = IdSets.EMPTY;
        for (final String extension : extensions) {
            final PostingList bucket = extensionIndex.get(extension);
            if (bucket != null) {
                result = IdSets.union(result, bucket.toArray());
            }
        }
        return result;
    }

    public int[] idsNamed(final String lowerName) {
        final PostingList bucket = nameIndex.get(lowerName);
        return bucket == null ? IdSets.EMPTY : bucket.toArray();
    }

    /**
     * Id of the live record with this full path, or -1. An exact match wins over a case-insensitive one.
     */
    public int idOf(final String fullPath) {
        final String lowerPath = fullPath.toLowerCase(Locale.ROOT);
        int caseInsensitive = -1;
        for (final int id : idsNamed(IndexedFile.nameOf(fullPath).toLowerCase(Locale.ROOT))) {
            final IndexedFile file = records.get(id);
            if (file == null) {
                continue;
            }
            if (file.fullPath().equals(fullPath)) {
                return id;
            }
            if (caseInsensitive < 0 && lowerPaths.get(id).equals(lowerPath)) {
                caseInsensitive = id;
            }
        }
        return caseInsensitive;
    }

    public int[] liveIds() {
        final int[] ids = new int[liveCount];
        int n = 0;
        for (int id = 0; id < records.size(); id++) {
            if (records.get(id) != null) {
                ids[n++] = id;
            }
        }
        return ids;
    }

    public List<IndexedFile> liveRecords() {
        final List<IndexedFile> result = new ArrayList<>(liveCount);
        for (final IndexedFile file : records) {
            if (file != null) {
                result.add(file);
            }
        }
        return result;
    }

    /**
     * Starts a copy-on-write modification of this generation. This store is left untouched.
     */
    public DriveStoreBuilder toBuilder() {
        return DriveStoreBuilder.copyOf(this);
    }

    List<@Nullable IndexedFile> records() {
        return records;
    }

    List<String> lowerNames() {
        return lowerNames;
    }

    List<String> lowerPaths() {
        return lowerPaths;
    }

    Map<String, PostingList> nameIndex() {
        return nameIndex;
    }

    Map<String, PostingList> extensionIndex() {
        return extensionIndex;
    }

    Map<String, PostingList> trigramIndex() {
        return trigramIndex;
    }

    Map<String, PostingList> directoryIndex() {
        return directoryIndex;
    }

    Map<String, Set<String>> directoryTrigramIndex() {
        return directoryTrigramIndex;
    }

    @Override
    public String toString() {
        return "DriveStore{drive=" + drive + ", generation=" + generation + ", live=" + liveCount + "}";
    }
}
