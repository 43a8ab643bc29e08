package com.starscape.imageresize.features.resizeimage.infra.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.starscape.imageresize.features.resizeimage.domain.NotificationRecord;

import java.util.List;

/**
 * S3 event notification as delivered to the queue.
 * The {@code s3:TestEvent} sent when a notification is configured has no records.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record S3EventNotification(
    @JsonProperty("Records") List<S3EventRecord> records,
    @JsonProperty("Event") String event
) {
    
    public List<NotificationRecord> toNotificationRecords() {
        if (records == null) {
            return List.of();
        }
        return records.stream()
                .map(S3EventRecord::toNotificationRecord)
                .toList();
    }
}
