package com.starscape.imageresize.features.resizeimage.infra.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * S3 bucket information from an S3 event notification record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record S3Bucket(
    @JsonProperty("name") String name,
    @JsonProperty("arn") String arn
) {}
