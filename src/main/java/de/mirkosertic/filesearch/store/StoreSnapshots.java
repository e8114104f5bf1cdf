package de.mirkosertic.filesearch.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip-compressed JSON snapshots of a drive's live records, one file per drive.
 * A snapshot is loaded into a fresh generation; ids are reassigned on load.
 */
public final class StoreSnapshots {

    private static final Logger logger = LoggerFactory.getLogger(StoreSnapshots.class);

    static final int FORMAT_VERSION = 1;
    private static final String SUFFIX = ".snapshot.json.gz";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private StoreSnapshots() {
    }

    /**
     * Serialized form of one drive.
     */
    public record Snapshot(int formatVersion, String drive, long generation, long createdAt, List<IndexedFile> files) {
    }

    public static Path fileFor(final Path directory, final String drive) {
        return directory.resolve(drive.replaceAll("[^A-Za-z0-9._-]", "_") + SUFFIX);
    }

    /**
     * Writes the store's live records, replacing any previous snapshot atomically where the filesystem allows.
     */
    public static void write(final DriveStore store, final Path file) throws IOException {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        final Snapshot snapshot = new Snapshot(FORMAT_VERSION, store.drive(), store.generation(),
                Instant.now().getEpochSecond(), store.liveRecords());
        try (final OutputStream out = new GZIPOutputStream(Files.newOutputStream(tmp))) {
            OBJECT_MAPPER.writeValue(out, snapshot);
        }
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.info("Wrote snapshot of drive '{}' with {} records to {}", store.drive(), store.liveCount(), file);
    }

    public static Snapshot readSnapshot(final Path file) throws IOException {
        final Snapshot snapshot;
        try (final InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            snapshot = OBJECT_MAPPER.readValue(in, Snapshot.class);
        }
        if (snapshot.formatVersion() != FORMAT_VERSION) {
            throw new IOException("Unsupported snapshot format version " + snapshot.formatVersion() + " in " + file);
        }
        return snapshot;
    }

    /**
     * Reads a snapshot into a new store generation for the given drive.
     *
     * @throws IOException if the file cannot be read, has another format or belongs to another drive
     */
    public static DriveStore read(final Path file, final String drive, final long generation) throws IOException {
        final Snapshot snapshot = readSnapshot(file);
        if (!drive.equals(snapshot.drive())) {
            throw new IOException("Snapshot " + file + " belongs to drive '" + snapshot.drive() + "', not '" + drive + "'");
        }
        final DriveStoreBuilder builder = DriveStoreBuilder.newGeneration(drive, generation);
        for (final IndexedFile indexed : snapshot.files()) {
            builder.add(indexed);
        }
        return builder.build();
    }
}
