package com.starscape.imageresize.features.resizeimage.domain;

import java.awt.image.BufferedImage;

/**
 * Outcome of a bounding-box resize: the dimensions before and after plus the resized raster.
 * The target never exceeds the original on either axis.
 */
public record ResizeResult(
    Dimensions original,
    Dimensions target,
    BufferedImage raster
) {
    
    public ResizeResult {
        if (target.width() > original.width() || target.height() > original.height()) {
            throw new IllegalArgumentException(
                "Target " + target + " exceeds original " + original);
        }
    }
}
