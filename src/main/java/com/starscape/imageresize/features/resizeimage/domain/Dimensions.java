package com.starscape.imageresize.features.resizeimage.domain;

import com.starscape.imageresize.common.domain.ValueObject;

public record Dimensions(
    int width,
    int height
) implements ValueObject {
    
    public Dimensions {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                "Dimensions must be positive: " + width + "x" + height);
        }
    }
    
    @Override
    public String toString() {
        return width + "x" + height;
    }
}
