package com.starscape.imageresize.features.resizeimage.domain;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Decode, resample and encode capability for raster images.
 */
public interface RasterCodec {
    
    /**
     * @throws ImageDecodeException if the file does not hold a decodable image
     */
    DecodedImage decode(Path source) throws IOException;
    
    BufferedImage resize(BufferedImage raster, Dimensions target) throws IOException;
    
    /**
     * Encodes {@code raster} into {@code destination}, in {@code format} when a writer for it exists.
     *
     * @return the format actually written
     */
    String encode(BufferedImage raster, String format, Path destination) throws IOException;
}
