package de.mirkosertic.filesearch.index;

import de.mirkosertic.filesearch.store.FileEntry;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Produces the entries below a drive's root. Implementations call the sink from the calling thread.
 */
public interface DriveWalker {

    /**
     * @throws IOException if the root cannot be walked at all
     */
    void walk(DriveSpec drive, Consumer<FileEntry> sink) throws IOException;
}
