package com.starscape.imageresize.features.resizeimage.app;

import com.starscape.imageresize.common.config.ProcessingProperties;
import com.starscape.imageresize.features.resizeimage.domain.BatchAbortedException;
import com.starscape.imageresize.features.resizeimage.domain.BatchFailurePolicy;
import com.starscape.imageresize.features.resizeimage.domain.BatchSummary;
import com.starscape.imageresize.features.resizeimage.domain.NotificationRecord;
import com.starscape.imageresize.features.resizeimage.domain.RecordOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Processes the records of one invocation sequentially, in input order.
 * <p>
 * Under {@link BatchFailurePolicy#HALT_ON_FIRST_FAILURE} the first failed record aborts the batch
 * with a {@link BatchAbortedException}; the remaining records are not attempted and no partial
 * summary is returned. Under {@link BatchFailurePolicy#CONTINUE_AND_AGGREGATE} every record is
 * attempted and failures are reported in the summary.
 */
@Service
public class NotificationBatchCoordinator {
    
    private static final Logger log = LoggerFactory.getLogger(NotificationBatchCoordinator.class);
    
    private final ImageRecordProcessor recordProcessor;
    private final BatchFailurePolicy policy;
    
    public NotificationBatchCoordinator(ImageRecordProcessor recordProcessor, ProcessingProperties properties) {
        this.recordProcessor = recordProcessor;
        this.policy = properties.getFailurePolicy() != null
                ? properties.getFailurePolicy()
                : BatchFailurePolicy.HALT_ON_FIRST_FAILURE;
    }
    
    public BatchSummary process(List<NotificationRecord> records) {
        log.info("Processing batch of {} record(s), policy={}", records.size(), policy);
        
        List<RecordOutcome> outcomes = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            RecordOutcome outcome = recordProcessor.process(records.get(i));
            outcomes.add(outcome);
            
            if (outcome instanceof RecordOutcome.Failure failure && policy == BatchFailurePolicy.HALT_ON_FIRST_FAILURE) {
                log.error("Halting batch at record {} of {}: {} failure for {}",
                        i + 1, records.size(), failure.kind(), failure.record().source());
                throw new BatchAbortedException(failure, i, records.size());
            }
        }
        
        BatchSummary summary = BatchSummary.of(outcomes);
        log.info("Batch finished: status={}, processed={}, skipped={}, failed={}",
                summary.statusCode(), summary.processedCount(), summary.skippedCount(), summary.failedCount());
        return summary;
    }
    
    public BatchFailurePolicy getPolicy() {
        return policy;
    }
}
