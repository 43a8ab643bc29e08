package com.starscape.imageresize.features.resizeimage.app;

import com.starscape.imageresize.features.resizeimage.domain.DegenerateMetadataException;
import com.starscape.imageresize.features.resizeimage.domain.DerivedMetrics;
import com.starscape.imageresize.features.resizeimage.domain.ImageMetadata;
import org.springframework.stereotype.Component;

@Component
public class DerivedMetricsCalculator {
    
    /**
     * Compare the original and resized image.
     * The reduction is {@code round((1 - resized/original) * 100)}, rounding half up.
     *
     * @throws DegenerateMetadataException if the original is zero bytes long
     */
    public DerivedMetrics calculate(ImageMetadata original, ImageMetadata resized) {
        if (original.sizeBytes() == 0) {
            throw new DegenerateMetadataException(
                "Original image is zero bytes; reduction percentage is undefined");
        }
        
        double ratio = (double) resized.sizeBytes() / original.sizeBytes();
        int reductionPercentage = (int) Math.round((1 - ratio) * 100);
        String dimensionChange = original.dimensions() + " → " + resized.dimensions();
        
        return new DerivedMetrics(reductionPercentage, dimensionChange);
    }
}
