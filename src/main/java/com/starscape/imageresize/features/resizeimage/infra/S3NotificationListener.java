package com.starscape.imageresize.features.resizeimage.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.imageresize.features.resizeimage.app.NotificationBatchCoordinator;
import com.starscape.imageresize.features.resizeimage.domain.BatchAbortedException;
import com.starscape.imageresize.features.resizeimage.domain.BatchSummary;
import com.starscape.imageresize.features.resizeimage.domain.NotificationRecord;
import com.starscape.imageresize.features.resizeimage.infra.events.InvocationResponse;
import com.starscape.imageresize.features.resizeimage.infra.events.S3EventNotification;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Listens to SQS messages carrying S3 event notifications and hands each batch of records
 * to the {@link NotificationBatchCoordinator}.
 * <p>
 * A halted batch is rethrown so the message is not acknowledged and the queue's redrive
 * policy applies to the whole batch.
 * 
 * Only enabled when spring.cloud.aws.sqs.enabled=true
 */
@Component
@ConditionalOnProperty(name = "spring.cloud.aws.sqs.enabled", havingValue = "true", matchIfMissing = false)
public class S3NotificationListener {
    
    private static final Logger log = LoggerFactory.getLogger(S3NotificationListener.class);
    
    private final NotificationBatchCoordinator coordinator;
    private final ObjectMapper objectMapper;
    
    public S3NotificationListener(NotificationBatchCoordinator coordinator, ObjectMapper objectMapper) {
        this.coordinator = coordinator;
        this.objectMapper = objectMapper;
    }
    
    /**
     * The queue URL is configured via ${aws.sqs.queue-url}.
     */
    @SqsListener("${aws.sqs.queue-url}")
    public void onMessage(String message) {
        handle(message);
    }
    
    InvocationResponse handle(String message) {
        log.debug("Received SQS message: {}", message);
        
        List<NotificationRecord> records;
        try {
            S3EventNotification notification = objectMapper.readValue(message, S3EventNotification.class);
            if (notification.event() != null) {
                log.info("Received S3 notification event: {}", notification.event());
            }
            records = notification.toNotificationRecords();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse S3 event notification", e);
            throw new IllegalArgumentException("Invalid message format", e);
        }
        
        try {
            BatchSummary summary = coordinator.process(records);
            InvocationResponse response = InvocationResponse.from(summary);
            log.info("Batch handled: {}", toJson(response));
            return response;
        } catch (BatchAbortedException e) {
            log.error("Batch failed and will be redriven: {}", e.getMessage());
            throw e;
        }
    }
    
    private String toJson(InvocationResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            return response.toString();
        }
    }
}
