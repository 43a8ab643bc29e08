package com.starscape.imageresize.features.resizeimage.infra.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.starscape.imageresize.features.resizeimage.domain.NotificationRecord;
import com.starscape.imageresize.features.resizeimage.domain.ObjectLocation;

/**
 * One entry of the {@code Records} array of an S3 event notification.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record S3EventRecord(
    @JsonProperty("eventVersion") String eventVersion,
    @JsonProperty("eventSource") String eventSource,
    @JsonProperty("awsRegion") String awsRegion,
    @JsonProperty("eventTime") String eventTime,
    @JsonProperty("eventName") String eventName,
    @JsonProperty("s3") S3Entity s3
) {
    
    /**
     * @throws IllegalArgumentException if the record carries no bucket name or object key
     */
    public NotificationRecord toNotificationRecord() {
        if (s3 == null || s3.bucket() == null || s3.object() == null) {
            throw new IllegalArgumentException("S3 event record without bucket or object: " + eventName);
        }
        return new NotificationRecord(
            new ObjectLocation(s3.bucket().name(), s3.object().key()),
            s3.object().size(),
            eventName,
            eventTime,
            eventSource,
            awsRegion,
            eventVersion
        );
    }
}
