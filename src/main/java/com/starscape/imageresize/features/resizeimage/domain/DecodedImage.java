package com.starscape.imageresize.features.resizeimage.domain;

import java.awt.image.BufferedImage;

/**
 * A decoded raster together with the format it was declared in.
 */
public record DecodedImage(
    BufferedImage raster,
    String format
) {
    
    public Dimensions dimensions() {
        return new Dimensions(raster.getWidth(), raster.getHeight());
    }
}
