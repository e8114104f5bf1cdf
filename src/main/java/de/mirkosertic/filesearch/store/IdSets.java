package de.mirkosertic.filesearch.store;

import java.util.Arrays;
import java.util.List;

/**
 * Set operations over ascending, duplicate-free id arrays.
 */
public final class IdSets {

    public static final int[] EMPTY = new int[0];

    private IdSets() {
    }

    public static int[] intersect(final int[] a, final int[] b) {
        final int[] out = new int[Math.min(a.length, b.length)];
        int i = 0;
        int j = 0;
        int n = 0;
        while (i < a.length && j < b.length) {
            if (a[i] < b[j]) {
                i++;
            } else if (a[i] > b[j]) {
                j++;
            } else {
                out[n++] = a[i];
                i++;
                j++;
            }
        }
        return n == out.length ? out : Arrays.copyOf(out, n);
    }

    public static int[] union(final int[] a, final int[] b) {
        if (a.length == 0) {
            return b;
        }
        if (b.length == 0) {
            return a;
        }
        final int[] out = new int[a.length + b.length];
        int i = 0;
        int j = 0;
        int n = 0;
        while (i < a.length || j < b.length) {
            if (j >= b.length || (i < a.length && a[i] < b[j])) {
                out[n++] = a[i++];
            } else if (i >= a.length || b[j] < a[i]) {
                out[n++] = b[j++];
            } else {
                out[n++] = a[i];
                i++;
                j++;
            }
        }
        return n == out.length ? out : Arrays.copyOf(out, n);
    }

    /**
     * Intersects all buckets, starting from the smallest to keep the running set minimal.
     */
    static int[] intersectAll(final List<PostingList> buckets) {
        if (buckets.isEmpty()) {
            return EMPTY;
        }
        final PostingList[] sorted = buckets.toArray(new PostingList[0]);
        Arrays.sort(sorted, (x, y) -> Integer.compare(x.size(), y.size()));
        int[] result = sorted[0].toArray();
        for (int k = 1; k < sorted.length && result.length > 0; k++) {
            final PostingList bucket = sorted[k];
            int n = 0;
            for (final int id : result) {
                if (bucket.contains(id)) {
                    result[n++] = id;
                }
            }
            result = n == result.length ? result : Arrays.copyOf(result, n);
        }
        return result;
    }
}
