package com.starscape.imageresize.features.resizeimage.domain;

import java.nio.file.Path;
import java.util.Map;

public interface ObjectStorage {
    
    /**
     * @throws StorageException if the object is missing, not readable or the store is unreachable
     */
    byte[] fetch(ObjectLocation location);
    
    /**
     * Writes (or overwrites) the object at {@code location} with the content of a local file.
     *
     * @throws StorageException if the write is rejected
     */
    void store(ObjectLocation location, Path content, String contentType, Map<String, String> metadata);
}
