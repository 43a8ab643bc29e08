package com.starscape.imageresize.features.resizeimage.domain;

import com.starscape.imageresize.common.domain.ValueObject;

/**
 * A bucket/key pair addressing one object in object storage.
 */
public record ObjectLocation(
    String bucket,
    String key
) implements ValueObject {
    
    public ObjectLocation {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("Bucket cannot be blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be blank");
        }
    }
    
    /**
     * The last path segment of the key.
     */
    public String basename() {
        int lastSlash = key.lastIndexOf('/');
        return lastSlash >= 0 ? key.substring(lastSlash + 1) : key;
    }
    
    @Override
    public String toString() {
        return "s3://" + bucket + "/" + key;
    }
}
