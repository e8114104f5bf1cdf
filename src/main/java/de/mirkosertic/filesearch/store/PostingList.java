package de.mirkosertic.filesearch.store;

import java.util.Arrays;

/**
 * Growable, ascending list of record ids forming one bucket of an inverted index.
 * Not thread-safe: buckets are only mutated by a {@link DriveStoreBuilder} before publication.
 */
final class PostingList {

    private int[] ids;
    private int size;

    PostingList() {
        this.ids = new int[4];
    }

    private PostingList(final int[] ids, final int size) {
        this.ids = ids;
        this.size = size;
    }

    void add(final int id) {
        if (size > 0 && ids[size - 1] >= id) {
            final int pos = Arrays.binarySearch(ids, 0, size, id);
            if (pos >= 0) {
                return;
            }
            insertAt(-pos - 1, id);
            return;
        }
        ensureCapacity(size + 1);
        ids[size++] = id;
    }

    boolean remove(final int id) {
        final int pos = Arrays.binarySearch(ids, 0, size, id);
        if (pos < 0) {
            return false;
        }
        System.arraycopy(ids, pos + 1, ids, pos, size - pos - 1);
        size--;
        return true;
    }

    boolean contains(final int id) {
        return Arrays.binarySearch(ids, 0, size, id) >= 0;
    }

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    int[] toArray() {
        return Arrays.copyOf(ids, size);
    }

    PostingList copy() {
        return new PostingList(Arrays.copyOf(ids, Math.max(4, size)), size);
    }

    private void insertAt(final int index, final int id) {
        ensureCapacity(size + 1);
        System.arraycopy(ids, index, ids, index + 1, size - index);
        ids[index] = id;
        size++;
    }

    private void ensureCapacity(final int required) {
        if (required > ids.length) {
            ids = Arrays.copyOf(ids, Math.max(required, ids.length * 2));
        }
    }
}
