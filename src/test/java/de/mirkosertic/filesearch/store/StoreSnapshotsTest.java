package de.mirkosertic.filesearch.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static de.mirkosertic.filesearch.store.TestEntries.dir;
import static de.mirkosertic.filesearch.store.TestEntries.file;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StoreSnapshots Tests")
class StoreSnapshotsTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should restore the live records into a new generation")
    void shouldRestoreLiveRecords() throws IOException {
        // Given
        final DriveStoreBuilder builder = TestEntries.store("D:",
                dir("D:\\Photos"),
                file("D:\\Photos\\holiday.jpg", 5 * TestEntries.MB, "2024-07-14", IndexedFile.HIDDEN),
                file("D:\\Photos\\old.jpg", 10)).toBuilder();
        builder.remove(2);
        final DriveStore store = builder.build();
        final Path file = StoreSnapshots.fileFor(tempDir, "D:");

        // When
        StoreSnapshots.write(store, file);
        final DriveStore restored = StoreSnapshots.read(file, "D:", 7);

        // Then
        assertThat(file).exists();
        assertThat(file.getFileName().toString()).isEqualTo("D_.snapshot.json.gz");
        assertThat(restored.generation()).isEqualTo(7);
        assertThat(restored.slotCount()).isEqualTo(2);
        assertThat(restored.liveRecords()).containsExactlyElementsOf(store.liveRecords());
        assertThat(restored.nameTrigramCandidates("holiday")).containsExactly(1);
        assertThat(restored.get(1).hasAttributes(IndexedFile.HIDDEN)).isTrue();
        assertThat(restored.idsWithExtensions(java.util.List.of("jpg"))).containsExactly(1);
    }

    @Test
    @DisplayName("Should refuse a snapshot of another drive")
    void shouldRefuseForeignDrive() throws IOException {
        final Path file = StoreSnapshots.fileFor(tempDir, "C:");
        StoreSnapshots.write(TestEntries.store("C:", file("C:\\a.txt", 1)), file);

        assertThatThrownBy(() -> StoreSnapshots.read(file, "E:", 1))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("belongs to drive 'C:'");
    }

    @Test
    @DisplayName("Should fail on a corrupt file")
    void shouldFailOnCorruptFile() throws IOException {
        final Path file = tempDir.resolve("broken.snapshot.json.gz");
        Files.writeString(file, "not gzip");

        assertThatThrownBy(() -> StoreSnapshots.read(file, "C:", 1)).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should not leave a temporary file behind")
    void shouldNotLeaveTemporaryFile() throws IOException {
        final Path file = StoreSnapshots.fileFor(tempDir.resolve("nested"), "/mnt/data");

        StoreSnapshots.write(TestEntries.store("/mnt/data", file("/mnt/data/a.txt", 1)), file);

        try (var files = Files.list(file.getParent())) {
            assertThat(files.map(p -> p.getFileName().toString()).toList())
                    .containsExactly("_mnt_data.snapshot.json.gz");
        }
    }
}
