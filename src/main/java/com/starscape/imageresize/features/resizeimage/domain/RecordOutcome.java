package com.starscape.imageresize.features.resizeimage.domain;

/**
 * Result of processing one notification record.
 */
public sealed interface RecordOutcome
        permits RecordOutcome.Success, RecordOutcome.Skipped, RecordOutcome.Failure {
    
    NotificationRecord record();
    
    record Success(NotificationRecord record, AuditRecord auditRecord) implements RecordOutcome {}
    
    /**
     * The record was recognised but deliberately not processed, e.g. a non-create event.
     */
    record Skipped(NotificationRecord record, String reason) implements RecordOutcome {}
    
    /**
     * Terminal failure. Temporary artifacts have already been released.
     */
    record Failure(NotificationRecord record, FailureKind kind, Exception cause) implements RecordOutcome {}
}
