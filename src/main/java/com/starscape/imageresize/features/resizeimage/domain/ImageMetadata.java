package com.starscape.imageresize.features.resizeimage.domain;

import com.starscape.imageresize.common.domain.ValueObject;

/**
 * Metadata read from an encoded image.
 * {@code sizeBytes} is the size of the encoded source, not of the decoded raster.
 */
public record ImageMetadata(
    int width,
    int height,
    String format,
    String colorMode,
    long sizeBytes
) implements ValueObject {
    
    public ImageMetadata {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                "Image dimensions must be positive: " + width + "x" + height);
        }
        if (format == null || format.isBlank()) {
            throw new IllegalArgumentException("Format cannot be blank");
        }
        if (colorMode == null || colorMode.isBlank()) {
            throw new IllegalArgumentException("Color mode cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("Size cannot be negative: " + sizeBytes);
        }
    }
    
    public Dimensions dimensions() {
        return new Dimensions(width, height);
    }
}
