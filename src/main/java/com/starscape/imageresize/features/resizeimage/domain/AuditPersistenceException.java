package com.starscape.imageresize.features.resizeimage.domain;

public class AuditPersistenceException extends ImageProcessingException {
    
    public AuditPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
    
    @Override
    public FailureKind kind() {
        return FailureKind.PERSISTENCE;
    }
}
