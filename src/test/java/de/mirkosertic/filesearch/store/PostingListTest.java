package de.mirkosertic.filesearch.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PostingList and IdSets Tests")
class PostingListTest {

    @Test
    @DisplayName("Should keep ids sorted and unique regardless of insertion order")
    void shouldKeepIdsSorted() {
        final PostingList list = new PostingList();
        for (final int id : new int[]{5, 1, 9, 5, 3, 1, 12, 7}) {
            list.add(id);
        }

        assertThat(list.toArray()).containsExactly(1, 3, 5, 7, 9, 12);
        assertThat(list.contains(7)).isTrue();
        assertThat(list.contains(8)).isFalse();
    }

    @Test
    @DisplayName("Removing should keep the order and report unknown ids")
    void shouldRemove() {
        final PostingList list = new PostingList();
        for (int id = 0; id < 10; id++) {
            list.add(id);
        }

        assertThat(list.remove(4)).isTrue();
        assertThat(list.remove(4)).isFalse();
        assertThat(list.remove(0)).isTrue();
        assertThat(list.toArray()).containsExactly(1, 2, 3, 5, 6, 7, 8, 9);
    }

    @Test
    @DisplayName("A copy should be independent of the original")
    void copyIsIndependent() {
        final PostingList original = new PostingList();
        original.add(1);
        original.add(2);

        final PostingList copy = original.copy();
        copy.add(3);
        copy.remove(1);

        assertThat(original.toArray()).containsExactly(1, 2);
        assertThat(copy.toArray()).containsExactly(2, 3);
    }

    @Test
    @DisplayName("Set operations should work on sorted arrays")
    void setOperations() {
        final int[] a = {1, 3, 5, 7, 9};
        final int[] b = {2, 3, 4, 7, 10};

        assertThat(IdSets.intersect(a, b)).containsExactly(3, 7);
        assertThat(IdSets.union(a, b)).containsExactly(1, 2, 3, 4, 5, 7, 9, 10);
        assertThat(IdSets.union(IdSets.EMPTY, b)).containsExactly(b);
        assertThat(IdSets.intersect(a, IdSets.EMPTY)).isEmpty();
    }

    @Test
    @DisplayName("Intersecting buckets should start from the smallest and honor all of them")
    void intersectAll() {
        final PostingList large = new PostingList();
        for (int id = 0; id < 100; id++) {
            large.add(id);
        }
        final PostingList small = new PostingList();
        small.add(10);
        small.add(20);
        small.add(200);
        final PostingList medium = new PostingList();
        for (int id = 0; id < 100; id += 10) {
            medium.add(id);
        }

        assertThat(IdSets.intersectAll(List.of(large, small, medium))).containsExactly(10, 20);
        assertThat(IdSets.intersectAll(List.of())).isEmpty();
    }
}
