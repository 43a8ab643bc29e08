package com.starscape.imageresize.features.resizeimage.domain;

/**
 * Base class for failures that terminate the processing of a single record.
 */
public abstract class ImageProcessingException extends RuntimeException {
    
    protected ImageProcessingException(String message) {
        super(message);
    }
    
    protected ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
    
    public abstract FailureKind kind();
}
