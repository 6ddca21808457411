package org.episim.io.formats;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes files through a temporary sibling that is renamed into place, so readers never observe
 * a partially written output.
 */
public final class AtomicFiles {

    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    /**
     * Callback producing the content of the temporary file.
     */
    @FunctionalInterface
    public interface FileWriter {
        void writeTo(Path tempFile) throws IOException;
    }

    private AtomicFiles() {
    }

    /**
     * @param target final location, replaced if present
     * @param writer fills the temporary file
     * @throws IOException if writing or renaming fails; the temporary file is removed
     */
    public static void write(Path target, FileWriter writer) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path tempFile = absolute.resolveSibling(absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            writer.writeTo(tempFile);
            try {
                Files.move(tempFile, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after write failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
    }
}
