package de.mirkosertic.filesearch.index;

import de.mirkosertic.filesearch.store.FileEntry;
import de.mirkosertic.filesearch.store.IndexedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.DosFileAttributes;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Walks a drive with {@link Files#walkFileTree}. Symbolic links are not followed, unreadable subtrees
 * are skipped, and an unreadable root fails the walk.
 */
public class FileSystemDriveWalker implements DriveWalker {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemDriveWalker.class);

    private final WalkFilter filter;

    public FileSystemDriveWalker(final WalkFilter filter) {
        this.filter = filter;
    }

    @Override
    public void walk(final DriveSpec drive, final Consumer<FileEntry> sink) throws IOException {
        final Path root = drive.root();
        if (!Files.exists(root)) {
            throw new NoSuchFileException(root.toString(), null, "Drive root does not exist");
        }
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        final boolean dosAttributes = "\\".equals(root.getFileSystem().getSeparator())
                && root.getFileSystem().supportedFileAttributeViews().contains("dos");

        Files.walkFileTree(root, new SimpleFileVisitor<>() {

            private long skipped;

            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                if (!filter.shouldDescend(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                sink.accept(toEntry(dir, attrs, dosAttributes));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (filter.shouldInclude(file)) {
                    sink.accept(toEntry(file, attrs, dosAttributes));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) throws IOException {
                if (file.equals(root)) {
                    throw exc;
                }
                skipped++;
                logger.debug("Skipping unreadable entry {}: {}", file, exc.toString());
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(final Path dir, final IOException exc) throws IOException {
                if (exc != null) {
                    if (dir.equals(root)) {
                        throw exc;
                    }
                    logger.debug("Directory {} was only partially read: {}", dir, exc.toString());
                }
                if (dir.equals(root) && skipped > 0) {
                    logger.info("Skipped {} unreadable entries below {}", skipped, root);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    static FileEntry toEntry(final Path path, final BasicFileAttributes attrs, final boolean dosAttributes) {
        final boolean directory = attrs.isDirectory();
        return new FileEntry(
                path.toString(),
                directory ? 0L : attrs.size(),
                attrs.lastModifiedTime().to(TimeUnit.SECONDS),
                directory,
                attributesOf(path, dosAttributes));
    }

    static int attributesOf(final Path path, final boolean dosAttributes) {
        if (dosAttributes) {
            try {
                final DosFileAttributes dos = Files.readAttributes(path, DosFileAttributes.class,
                        LinkOption.NOFOLLOW_LINKS);
                int bits = 0;
                if (dos.isHidden()) {
                    bits |= IndexedFile.HIDDEN;
                }
                if (dos.isReadOnly()) {
                    bits |= IndexedFile.READ_ONLY;
                }
                if (dos.isSystem()) {
                    bits |= IndexedFile.SYSTEM;
                }
                return bits;
            } catch (final IOException | UnsupportedOperationException e) {
                logger.debug("Falling back to portable attributes for {}: {}", path, e.toString());
            }
        }
        int bits = 0;
        final Path name = path.getFileName();
        if (name != null && name.toString().startsWith(".")) {
            bits |= IndexedFile.HIDDEN;
        }
        if (!Files.isWritable(path)) {
            bits |= IndexedFile.READ_ONLY;
        }
        return bits;
    }
}
