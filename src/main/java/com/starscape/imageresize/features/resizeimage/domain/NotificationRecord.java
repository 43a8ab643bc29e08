package com.starscape.imageresize.features.resizeimage.domain;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * One unit of work: a newly created source object as described by a storage notification.
 * The key in {@code source} is kept exactly as delivered, i.e. URL-encoded.
 *
 * @param sizeHint size reported by the notification, {@code null} when absent; never trusted
 */
public record NotificationRecord(
    ObjectLocation source,
    Long sizeHint,
    String eventName,
    String eventTime,
    String eventSource,
    String region,
    String eventVersion
) {
    
    public NotificationRecord {
        if (source == null) {
            throw new IllegalArgumentException("Source location cannot be null");
        }
    }
    
    /**
     * The source location with the key decoded to its literal form
     * ({@code +} becomes a space, {@code %XX} sequences are decoded as UTF-8).
     */
    public ObjectLocation decodedSource() {
        return new ObjectLocation(source.bucket(), URLDecoder.decode(source.key(), StandardCharsets.UTF_8));
    }
    
    public boolean isObjectCreated() {
        return eventName != null && eventName.startsWith("ObjectCreated");
    }
}
