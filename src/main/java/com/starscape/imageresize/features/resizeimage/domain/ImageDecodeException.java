package com.starscape.imageresize.features.resizeimage.domain;

public class ImageDecodeException extends ImageProcessingException {
    
    public ImageDecodeException(String message) {
        super(message);
    }
    
    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
    
    @Override
    public FailureKind kind() {
        return FailureKind.DECODE;
    }
}
