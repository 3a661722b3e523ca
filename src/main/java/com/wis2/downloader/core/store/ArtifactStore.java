package com.wis2.downloader.core.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Filesystem side of the pipeline: existence check and placement of downloaded files.
 *
 * <p>The existence check is the pipeline's only de-duplication. It is path based, not content based: a file that
 * is already there is never fetched again, even if it is corrupt.</p>
 *
 * <p>Writes go to a temporary sibling first and are then moved into place, so a half-written file is never seen
 * by the existence check of another worker.</p>
 */
public class ArtifactStore {

    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    /**
     * Creates all missing parent directories. Another worker creating the same directory at the same time is fine.
     */
    public void ensureParentDirs(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    public void write(Path path, byte[] content) throws IOException {
        ensureParentDirs(path);
        Path parent = path.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(parent, "." + path.getFileName(), ".part");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
