package de.mirkosertic.filesearch.store;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mutable, single-threaded producer of a {@link DriveStore}.
 * <p>
 * A builder either starts an empty generation or continues from a published store. In the latter
 * case the record lists and index maps are copied shallowly and every bucket is cloned on its first
 * write, so readers of the published store never observe a change. After {@link #build()} the
 * builder refuses further modification.
 */
public final class DriveStoreBuilder {

    private final String drive;
    private final long generation;
    private final ArrayList<@Nullable IndexedFile> records;
    private final ArrayList<String> lowerNames;
    private final ArrayList<String> lowerPaths;
    private final Map<String, PostingList> nameIndex;
    private final Map<String, PostingList> extensionIndex;
    private final Map<String, PostingList> trigramIndex;
    private final Map<String, PostingList> directoryIndex;
    private final Map<String, Set<String>> directoryTrigramIndex;
    // buckets created or already cloned by this builder
    private final Set<Object> owned = Collections.newSetFromMap(new IdentityHashMap<>());
    private int liveCount;
    private boolean built;

    private DriveStoreBuilder(final String drive, final long generation,
                              final ArrayList<@Nullable IndexedFile> records,
                              final ArrayList<String> lowerNames,
                              final ArrayList<String> lowerPaths,
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

    public static DriveStoreBuilder newGeneration(final String drive, final long generation) {
        return new DriveStoreBuilder(drive, generation, new ArrayList<>(), new ArrayList<>(), new ArrayList<>(),
                new HashMap<>(), new HashMap<>(), new HashMap<>(), new HashMap<>(), new HashMap<>(), 0);
    }

    static DriveStoreBuilder copyOf(final DriveStore store) {
        return new DriveStoreBuilder(store.drive(), store.generation(),
                new ArrayList<>(store.records()),
                new ArrayList<>(store.lowerNames()),
                new ArrayList<>(store.lowerPaths()),
                new HashMap<>(store.nameIndex()),
                new HashMap<>(store.extensionIndex()),
                new HashMap<>(store.trigramIndex()),
                new HashMap<>(store.directoryIndex()),
                new HashMap<>(store.directoryTrigramIndex()),
                store.liveCount());
    }

    public int add(final FileEntry entry) {
        return add(IndexedFile.fromEntry(entry));
    }

    /**
     * Appends the record and indexes it.
     *
     * @return the id of the new record
     */
    public int add(final IndexedFile file) {
        checkNotBuilt();
        final int id = records.size();
        final String lowerName = file.name().toLowerCase(Locale.ROOT);
        final String lowerPath = file.fullPath().toLowerCase(Locale.ROOT);
        records.add(file);
        lowerNames.add(lowerName);
        lowerPaths.add(lowerPath);

        writableBucket(nameIndex, lowerName).add(id);
        if (!file.directory() && !file.extension().isEmpty()) {
            writableBucket(extensionIndex, file.extension()).add(id);
        }
        for (final String trigram : Trigrams.of(lowerName)) {
            writableBucket(trigramIndex, trigram).add(id);
        }
        final String parent = file.parentPath().toLowerCase(Locale.ROOT);
        if (!directoryIndex.containsKey(parent)) {
            for (final String trigram : Trigrams.of(parent)) {
                writableDirectorySet(trigram).add(parent);
            }
        }
        writableBucket(directoryIndex, parent).add(id);
        liveCount++;
        return id;
    }

    /**
     * Tombstones the record and purges its id from every bucket.
     *
     * @return false if the id was unknown or already removed
     */
    public boolean remove(final int id) {
        checkNotBuilt();
        if (id < 0 || id >= records.size()) {
            return false;
        }
        final IndexedFile file = records.get(id);
        if (file == null) {
            return false;
        }
        final String lowerName = lowerNames.get(id);
        purge(nameIndex, lowerName, id);
        if (!file.directory() && !file.extension().isEmpty()) {
            purge(extensionIndex, file.extension(), id);
        }
        for (final String trigram : Trigrams.of(lowerName)) {
            purge(trigramIndex, trigram, id);
        }
        final String parent = file.parentPath().toLowerCase(Locale.ROOT);
        if (purge(directoryIndex, parent, id)) {
            for (final String trigram : Trigrams.of(parent)) {
                final Set<String> directories = writableDirectorySet(trigram);
                directories.remove(parent);
                if (directories.isEmpty()) {
                    directoryTrigramIndex.remove(trigram);
                }
            }
        }
        records.set(id, null);
        liveCount--;
        return true;
    }

    /**
     * Removes the live record with this full path, found through the name index.
     */
    public boolean removeByPath(final String fullPath) {
        checkNotBuilt();
        final int id = snapshotForLookup().idOf(IndexedFile.normalizePath(fullPath));
        return id >= 0 && remove(id);
    }

    public int liveCount() {
        return liveCount;
    }

    public DriveStore build() {
        checkNotBuilt();
        built = true;
        return snapshotForLookup();
    }

    private DriveStore snapshotForLookup() {
        return new DriveStore(drive, generation, records, lowerNames, lowerPaths, nameIndex, extensionIndex,
                trigramIndex, directoryIndex, directoryTrigramIndex, liveCount);
    }

    private PostingList writableBucket(final Map<String, PostingList> index, final String key) {
        final PostingList existing = index.get(key);
        if (existing == null) {
            final PostingList created = new PostingList();
            owned.add(created);
            index.put(key, created);
            return created;
        }
        if (owned.contains(existing)) {
            return existing;
        }
        final PostingList copy = existing.copy();
        owned.add(copy);
        index.put(key, copy);
        return copy;
    }

    private Set<String> writableDirectorySet(final String trigram) {
        final Set<String> existing = directoryTrigramIndex.get(trigram);
        if (existing == null) {
            final Set<String> created = new HashSet<>();
            owned.add(created);
            directoryTrigramIndex.put(trigram, created);
            return created;
        }
        if (owned.contains(existing)) {
            return existing;
        }
        final Set<String> copy = new HashSet<>(existing);
        owned.add(copy);
        directoryTrigramIndex.put(trigram, copy);
        return copy;
    }

    /**
     * @return true if the bucket became empty and was dropped
     */
    private boolean purge(final Map<String, PostingList> index, final String key, final int id) {
        final PostingList existing = index.get(key);
        if (existing == null || !existing.contains(id)) {
            return false;
        }
        final PostingList bucket = writableBucket(index, key);
        bucket.remove(id);
        if (bucket.isEmpty()) {
            index.remove(key);
            return true;
        }
        return false;
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Store for drive " + drive + " has already been built");
        }
    }
}
