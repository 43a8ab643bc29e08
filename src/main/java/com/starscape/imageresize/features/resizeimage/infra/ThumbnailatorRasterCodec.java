package com.starscape.imageresize.features.resizeimage.infra;

import com.drew.imaging.FileType;
import com.drew.imaging.FileTypeDetector;
import com.starscape.imageresize.features.resizeimage.domain.DecodedImage;
import com.starscape.imageresize.features.resizeimage.domain.Dimensions;
import com.starscape.imageresize.features.resizeimage.domain.ImageDecodeException;
import com.starscape.imageresize.features.resizeimage.domain.RasterCodec;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

/**
 * Raster codec backed by ImageIO for decoding and encoding and Thumbnailator for resampling.
 * The declared format is sniffed from the file header with metadata-extractor, falling back to
 * the name of the ImageIO reader that accepted the file.
 */
@Component
public class ThumbnailatorRasterCodec implements RasterCodec {
    
    private static final Logger log = LoggerFactory.getLogger(ThumbnailatorRasterCodec.class);
    
    private static final String FALLBACK_FORMAT = "png";
    
    @Override
    public DecodedImage decode(Path source) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(source.toFile())) {
            if (in == null) {
                throw new ImageDecodeException("Cannot open image stream for " + source.getFileName());
            }
            
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new ImageDecodeException("Not a decodable image: " + source.getFileName());
            }
            
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                BufferedImage raster = reader.read(0);
                return new DecodedImage(raster, declaredFormat(source, reader.getFormatName()));
            } catch (IOException | RuntimeException e) {
                throw new ImageDecodeException(
                    "Corrupt " + reader.getFormatName() + " data in " + source.getFileName() + ": " + e.getMessage(), e);
            } finally {
                reader.dispose();
            }
        }
    }
    
    @Override
    public BufferedImage resize(BufferedImage raster, Dimensions target) throws IOException {
        return Thumbnails.of(raster)
                .forceSize(target.width(), target.height())
                .imageType(outputImageType(raster))
                .asBufferedImage();
    }
    
    @Override
    public String encode(BufferedImage raster, String format, Path destination) throws IOException {
        String writerFormat = writerFormatFor(raster, format);
        try (OutputStream out = Files.newOutputStream(destination)) {
            if (!ImageIO.write(raster, writerFormat, out)) {
                throw new IOException("No " + writerFormat + " writer accepted the image");
            }
        }
        return writerFormat.toUpperCase(Locale.ROOT);
    }
    
    private String declaredFormat(Path source, String readerFormat) throws IOException {
        try (BufferedInputStream in = new BufferedInputStream(Files.newInputStream(source))) {
            FileType fileType = FileTypeDetector.detectFileType(in);
            if (fileType != FileType.Unknown) {
                return fileType.getName().toUpperCase(Locale.ROOT);
            }
        }
        return readerFormat.toUpperCase(Locale.ROOT);
    }
    
    /**
     * The source format when one of its writers can encode this pixel layout (a BMP writer
     * refuses alpha, a JPEG writer refuses ARGB), PNG otherwise.
     */
    private String writerFormatFor(BufferedImage raster, String format) {
        String name = format == null ? FALLBACK_FORMAT : format.toLowerCase(Locale.ROOT);
        if (ImageIO.getImageWriters(ImageTypeSpecifier.createFromRenderedImage(raster), name).hasNext()) {
            return name;
        }
        log.warn("No {} encoder accepts a {}x{} raster of type {}, writing {} instead",
                format, raster.getWidth(), raster.getHeight(), raster.getType(), FALLBACK_FORMAT);
        return FALLBACK_FORMAT;
    }
    
    /**
     * Keep the source pixel layout where it is a standard one; palette and custom layouts are
     * resampled in RGB(A).
     */
    private int outputImageType(BufferedImage raster) {
        int type = raster.getType();
        if (type == BufferedImage.TYPE_CUSTOM
                || type == BufferedImage.TYPE_BYTE_INDEXED
                || type == BufferedImage.TYPE_BYTE_BINARY) {
            return raster.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        }
        return type;
    }
}
