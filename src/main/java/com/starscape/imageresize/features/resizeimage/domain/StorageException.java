package com.starscape.imageresize.features.resizeimage.domain;

/**
 * Failure of an object storage fetch or store call.
 */
public class StorageException extends ImageProcessingException {
    
    public enum Reason {
        NOT_FOUND,
        ACCESS_DENIED,
        UNAVAILABLE
    }
    
    private final Reason reason;
    private final ObjectLocation location;
    
    public StorageException(Reason reason, ObjectLocation location, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.location = location;
    }
    
    public Reason getReason() {
        return reason;
    }
    
    public ObjectLocation getLocation() {
        return location;
    }
    
    @Override
    public FailureKind kind() {
        return FailureKind.STORAGE;
    }
}
