package com.starscape.imageresize.features.resizeimage.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Local scratch file owned by a single record's processing.
 * The file name comes from a fresh UUID, never from the object key, so concurrent records
 * referencing same-named objects cannot collide. Closing deletes the file; a failed delete is
 * logged and otherwise ignored.
 */
public final class TemporaryArtifact implements AutoCloseable {
    
    private static final Logger log = LoggerFactory.getLogger(TemporaryArtifact.class);
    
    private final Path path;
    
    private TemporaryArtifact(Path path) {
        this.path = path;
    }
    
    /**
     * Reserve a new artifact path in {@code directory}. The file is created by the first write.
     *
     * @param role short label appended to the name, e.g. "original"
     */
    public static TemporaryArtifact in(Path directory, String role) {
        return new TemporaryArtifact(directory.resolve(UUID.randomUUID() + "-" + role));
    }
    
    public Path path() {
        return path;
    }
    
    public long size() throws IOException {
        return Files.size(path);
    }
    
    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not clean up temporary file {}: {}", path, e.getMessage());
        }
    }
}
