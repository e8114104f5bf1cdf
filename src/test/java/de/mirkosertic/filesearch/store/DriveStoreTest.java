package de.mirkosertic.filesearch.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static de.mirkosertic.filesearch.store.TestEntries.dir;
import static de.mirkosertic.filesearch.store.TestEntries.file;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DriveStore Tests")
class DriveStoreTest {

    private DriveStore store;

    @BeforeEach
    void setUp() {
        store = TestEntries.store("C:",
                dir("C:\\Projects"),
                file("C:\\Projects\\project_report.doc", 100),
                file("C:\\Projects\\project_backup.zip", 200),
                dir("C:\\Projects\\Reports"),
                file("C:\\Projects\\Reports\\q1.xlsx", 300),
                file("C:\\Music\\song.mp3", 400));
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("Should assign ids in insertion order")
        void shouldAssignIds() {
            assertThat(store.slotCount()).isEqualTo(6);
            assertThat(store.liveCount()).isEqualTo(6);
            assertThat(store.get(1).name()).isEqualTo("project_report.doc");
            assertThat(store.lowerPath(4)).isEqualTo("c:\\projects\\reports\\q1.xlsx");
            assertThat(store.get(99)).isNull();
        }

        @Test
        @DisplayName("Name trigram candidates should contain every name with all trigrams")
        void nameTrigramCandidates() {
            assertThat(store.nameTrigramCandidates("project")).containsExactly(0, 1, 2);
            assertThat(store.nameTrigramCandidates("report")).containsExactly(1, 3);
            assertThat(store.nameTrigramCandidates("zzz")).isEmpty();
        }

        @Test
        @DisplayName("Directory candidates should be the children of matching directories")
        void directoryCandidates() {
            assertThat(store.directoryChildCandidates("projects")).containsExactly(1, 2, 3, 4);
            assertThat(store.directoryChildCandidates("reports")).containsExactly(4);
            assertThat(store.directoryChildCandidates("music")).containsExactly(5);
        }

        @Test
        @DisplayName("Extension and name lookups should use the indices")
        void extensionAndName() {
            assertThat(store.idsWithExtensions(java.util.List.of("doc", "zip"))).containsExactly(1, 2);
            assertThat(store.idsWithExtensions(java.util.List.of("none"))).isEmpty();
            assertThat(store.idsNamed("song.mp3")).containsExactly(5);
        }

        @Test
        @DisplayName("Should find ids by full path, preferring an exact match")
        void idOfPath() {
            assertThat(store.idOf("C:\\Music\\song.mp3")).isEqualTo(5);
            assertThat(store.idOf("c:\\music\\SONG.mp3")).isEqualTo(5);
            assertThat(store.idOf("C:\\Music\\other.mp3")).isEqualTo(-1);
        }
    }

    @Nested
    @DisplayName("Incremental updates")
    class IncrementalUpdates {

        @Test
        @DisplayName("Removing should tombstone the slot and purge every index")
        void removeShouldPurge() {
            final DriveStoreBuilder builder = store.toBuilder();

            assertThat(builder.remove(1)).isTrue();
            assertThat(builder.remove(1)).isFalse();
            final DriveStore next = builder.build();

            assertThat(next.get(1)).isNull();
            assertThat(next.liveCount()).isEqualTo(5);
            assertThat(next.slotCount()).isEqualTo(6);
            assertThat(next.nameTrigramCandidates("report")).containsExactly(3);
            assertThat(next.idsWithExtensions(java.util.List.of("doc"))).isEmpty();
            assertThat(next.idsNamed("project_report.doc")).isEmpty();
            assertThat(next.liveIds()).containsExactly(0, 2, 3, 4, 5);
        }

        @Test
        @DisplayName("Removing the last child should drop the directory from the directory indices")
        void removeLastChild() {
            final DriveStoreBuilder builder = store.toBuilder();
            builder.remove(5);
            final DriveStore next = builder.build();

            assertThat(next.directoryChildCandidates("music")).isEmpty();
        }

        @Test
        @DisplayName("Copy-on-write should leave the published store untouched")
        void copyOnWriteIsolation() {
            final DriveStoreBuilder builder = store.toBuilder();
            builder.remove(1);
            builder.add(file("C:\\Projects\\project_plan.doc", 10));
            final DriveStore next = builder.build();

            assertThat(store.liveCount()).isEqualTo(6);
            assertThat(store.get(1)).isNotNull();
            assertThat(store.nameTrigramCandidates("project")).containsExactly(0, 1, 2);
            assertThat(store.slotCount()).isEqualTo(6);

            assertThat(next.nameTrigramCandidates("project")).containsExactly(0, 2, 6);
            assertThat(next.generation()).isEqualTo(store.generation());
        }

        @Test
        @DisplayName("Removing by path should resolve the id through the name index")
        void removeByPath() {
            final DriveStoreBuilder builder = store.toBuilder();

            assertThat(builder.removeByPath("C:\\Projects\\Reports\\q1.xlsx")).isTrue();
            assertThat(builder.removeByPath("C:\\Projects\\Reports\\q1.xlsx")).isFalse();
            assertThat(builder.build().liveCount()).isEqualTo(5);
        }

        @Test
        @DisplayName("A built builder should refuse modifications")
        void builtBuilderIsSealed() {
            final DriveStoreBuilder builder = DriveStoreBuilder.newGeneration("C:", 1);
            builder.build();

            assertThatThrownBy(() -> builder.add(file("C:\\x.txt", 1)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
