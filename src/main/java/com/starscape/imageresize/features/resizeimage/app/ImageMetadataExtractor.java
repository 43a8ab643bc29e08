package com.starscape.imageresize.features.resizeimage.app;

import com.starscape.imageresize.features.resizeimage.domain.DecodedImage;
import com.starscape.imageresize.features.resizeimage.domain.ImageMetadata;
import com.starscape.imageresize.features.resizeimage.domain.RasterCodec;
import org.springframework.stereotype.Component;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads width, height, declared format and color mode of an encoded image.
 * Color modes use the conventional short tags: 1, L, LA, P, RGB, RGBA, CMYK.
 */
@Component
public class ImageMetadataExtractor {
    
    private final RasterCodec codec;
    
    public ImageMetadataExtractor(RasterCodec codec) {
        this.codec = codec;
    }
    
    /**
     * Decode the file and describe it. The byte size is the size of the file itself.
     *
     * @throws com.starscape.imageresize.features.resizeimage.domain.ImageDecodeException
     *         if the file is not a decodable image
     */
    public ImageMetadata extract(Path source) throws IOException {
        DecodedImage image = codec.decode(source);
        return extract(image, Files.size(source));
    }
    
    /**
     * Describe an already decoded image whose encoded form is {@code sizeBytes} long.
     */
    public ImageMetadata extract(DecodedImage image, long sizeBytes) {
        BufferedImage raster = image.raster();
        return new ImageMetadata(
            raster.getWidth(),
            raster.getHeight(),
            image.format(),
            colorMode(raster),
            sizeBytes
        );
    }
    
    static String colorMode(BufferedImage raster) {
        ColorModel colorModel = raster.getColorModel();
        if (colorModel instanceof IndexColorModel) {
            return colorModel.getPixelSize() == 1 ? "1" : "P";
        }
        
        boolean alpha = colorModel.hasAlpha();
        return switch (colorModel.getColorSpace().getType()) {
            case ColorSpace.TYPE_GRAY -> alpha ? "LA" : "L";
            case ColorSpace.TYPE_CMYK -> "CMYK";
            default -> alpha ? "RGBA" : "RGB";
        };
    }
}
