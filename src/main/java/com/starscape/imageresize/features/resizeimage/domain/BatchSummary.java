package com.starscape.imageresize.features.resizeimage.domain;

import java.util.List;

/**
 * Aggregated result of one batch invocation.
 *
 * @param statusCode 200 when every attempted record succeeded or was skipped, 207 when some failed
 */
public record BatchSummary(
    int statusCode,
    String message,
    int processedCount,
    int skippedCount,
    int failedCount,
    List<RecordOutcome> outcomes
) {
    
    public static final int STATUS_OK = 200;
    public static final int STATUS_PARTIAL = 207;
    
    public static BatchSummary of(List<RecordOutcome> outcomes) {
        int processed = 0;
        int skipped = 0;
        int failed = 0;
        for (RecordOutcome outcome : outcomes) {
            if (outcome instanceof RecordOutcome.Success) {
                processed++;
            } else if (outcome instanceof RecordOutcome.Skipped) {
                skipped++;
            } else {
                failed++;
            }
        }
        
        if (failed == 0) {
            return new BatchSummary(STATUS_OK, "Image processing completed successfully",
                processed, skipped, 0, List.copyOf(outcomes));
        }
        return new BatchSummary(STATUS_PARTIAL,
            "Image processing completed with " + failed + " failed record(s)",
            processed, skipped, failed, List.copyOf(outcomes));
    }
    
    public boolean isSuccess() {
        return failedCount == 0;
    }
}
