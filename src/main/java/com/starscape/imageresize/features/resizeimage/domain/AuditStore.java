package com.starscape.imageresize.features.resizeimage.domain;

public interface AuditStore {
    
    /**
     * Appends one audit entry. Entries are never updated or deleted.
     *
     * @throws AuditPersistenceException if the write fails
     */
    void put(AuditRecord record);
}
