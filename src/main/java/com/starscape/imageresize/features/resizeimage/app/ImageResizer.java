package com.starscape.imageresize.features.resizeimage.app;

import com.starscape.imageresize.features.resizeimage.domain.Dimensions;
import com.starscape.imageresize.features.resizeimage.domain.RasterCodec;
import com.starscape.imageresize.features.resizeimage.domain.ResizeResult;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Shrinks a raster to fit within half of its original width and height.
 * <p>
 * The bounding box is {@code max(1, w/2) x max(1, h/2)}. The image is scaled uniformly by
 * {@code min(1, boxW/w, boxH/h)} so the aspect ratio is kept and nothing is ever upscaled;
 * the non-limiting axis may therefore end up above or below exactly 50%.
 */
@Component
public class ImageResizer {
    
    private final RasterCodec codec;
    
    public ImageResizer(RasterCodec codec) {
        this.codec = codec;
    }
    
    public ResizeResult resize(BufferedImage raster) throws IOException {
        Dimensions original = new Dimensions(raster.getWidth(), raster.getHeight());
        Dimensions target = targetDimensions(original);
        
        // 1px-wide images can hit a box equal to the original
        BufferedImage resized = target.equals(original) ? raster : codec.resize(raster, target);
        return new ResizeResult(original, target, resized);
    }
    
    /**
     * Largest aspect-preserving size that fits within the half-dimension box, never below 1px.
     */
    public static Dimensions targetDimensions(Dimensions original) {
        int boxWidth = Math.max(1, original.width() / 2);
        int boxHeight = Math.max(1, original.height() / 2);
        
        double scale = Math.min(1.0, Math.min(
            (double) boxWidth / original.width(),
            (double) boxHeight / original.height()));
        
        int width = fit(Math.round(original.width() * scale), boxWidth);
        int height = fit(Math.round(original.height() * scale), boxHeight);
        return new Dimensions(width, height);
    }
    
    private static int fit(long scaled, int limit) {
        return (int) Math.max(1, Math.min(limit, scaled));
    }
}
