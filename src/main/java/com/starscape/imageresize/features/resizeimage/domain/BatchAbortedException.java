package com.starscape.imageresize.features.resizeimage.domain;

/**
 * Raised when a batch is halted by a record failure.
 * Signals the invoker that the whole batch must be treated as failed.
 */
public class BatchAbortedException extends RuntimeException {
    
    private final RecordOutcome.Failure failure;
    private final int recordIndex;
    private final int batchSize;
    
    public BatchAbortedException(RecordOutcome.Failure failure, int recordIndex, int batchSize) {
        super(String.format("Batch aborted at record %d of %d (%s, %s): %s",
                recordIndex + 1, batchSize, failure.kind(), failure.record().source(),
                failure.cause().getMessage()),
            failure.cause());
        this.failure = failure;
        this.recordIndex = recordIndex;
        this.batchSize = batchSize;
    }
    
    public RecordOutcome.Failure getFailure() {
        return failure;
    }
    
    /**
     * Zero-based position of the failed record in the batch.
     */
    public int getRecordIndex() {
        return recordIndex;
    }
    
    public int getBatchSize() {
        return batchSize;
    }
}
