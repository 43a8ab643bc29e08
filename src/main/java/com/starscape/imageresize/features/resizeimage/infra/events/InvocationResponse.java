package com.starscape.imageresize.features.resizeimage.infra.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.starscape.imageresize.features.resizeimage.domain.BatchSummary;

/**
 * Result reported for one successfully handled batch.
 */
public record InvocationResponse(
    @JsonProperty("statusCode") int statusCode,
    @JsonProperty("body") Body body
) {
    
    public record Body(
        @JsonProperty("message") String message,
        @JsonProperty("processed_count") int processedCount
    ) {}
    
    public static InvocationResponse from(BatchSummary summary) {
        return new InvocationResponse(
            summary.statusCode(),
            new Body(summary.message(), summary.processedCount())
        );
    }
}
