package com.starscape.imageresize.features.resizeimage.infra.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * S3 object information from an S3 event notification record.
 * The key is URL-encoded; size is absent for some event types.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record S3Object(
    @JsonProperty("key") String key,
    @JsonProperty("size") Long size,
    @JsonProperty("eTag") String eTag,
    @JsonProperty("sequencer") String sequencer
) {}
