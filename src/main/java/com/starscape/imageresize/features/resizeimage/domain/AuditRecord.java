package com.starscape.imageresize.features.resizeimage.domain;

import java.time.Instant;

/**
 * Append-only description of one completed transformation.
 * Keyed by a freshly generated id so that re-processing the same object never collides.
 */
public record AuditRecord(
    String resourceId,
    NotificationRecord event,
    ObjectLocation original,
    ImageMetadata originalMetadata,
    String originalChecksum,
    ObjectLocation resized,
    ImageMetadata resizedMetadata,
    DerivedMetrics metrics,
    Instant processingTime
) {
    
    public AuditRecord {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("Resource id cannot be blank");
        }
    }
}
