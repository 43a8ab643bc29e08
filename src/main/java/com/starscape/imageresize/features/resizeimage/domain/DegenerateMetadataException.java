package com.starscape.imageresize.features.resizeimage.domain;

/**
 * Raised when metadata cannot be compared, most notably when the original is zero bytes long.
 */
public class DegenerateMetadataException extends ImageProcessingException {
    
    public DegenerateMetadataException(String message) {
        super(message);
    }
    
    @Override
    public FailureKind kind() {
        return FailureKind.DEGENERATE_METADATA;
    }
}
