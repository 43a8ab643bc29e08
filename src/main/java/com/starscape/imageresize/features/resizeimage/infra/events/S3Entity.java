package com.starscape.imageresize.features.resizeimage.infra.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record S3Entity(
    @JsonProperty("s3SchemaVersion") String schemaVersion,
    @JsonProperty("configurationId") String configurationId,
    @JsonProperty("bucket") S3Bucket bucket,
    @JsonProperty("object") S3Object object
) {}
