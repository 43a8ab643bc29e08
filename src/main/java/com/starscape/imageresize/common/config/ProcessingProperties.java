package com.starscape.imageresize.common.config;

import com.starscape.imageresize.features.resizeimage.domain.BatchFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Configuration properties for image processing.
 * Binds to app.processing.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.processing")
public class ProcessingProperties {
    
    private String destinationBucket;
    private String destinationKeyPrefix = "resized-";
    private Path workDirectory = Path.of(System.getProperty("java.io.tmpdir"));
    private BatchFailurePolicy failurePolicy = BatchFailurePolicy.HALT_ON_FIRST_FAILURE;
    
    public String getDestinationBucket() {
        return destinationBucket;
    }
    
    public void setDestinationBucket(String destinationBucket) {
        this.destinationBucket = destinationBucket;
    }
    
    public String getDestinationKeyPrefix() {
        return destinationKeyPrefix;
    }
    
    public void setDestinationKeyPrefix(String destinationKeyPrefix) {
        this.destinationKeyPrefix = destinationKeyPrefix;
    }
    
    /**
     * Directory holding the per-record temporary files.
     */
    public Path getWorkDirectory() {
        return workDirectory;
    }
    
    public void setWorkDirectory(Path workDirectory) {
        this.workDirectory = workDirectory;
    }
    
    public BatchFailurePolicy getFailurePolicy() {
        return failurePolicy;
    }
    
    public void setFailurePolicy(BatchFailurePolicy failurePolicy) {
        this.failurePolicy = failurePolicy;
    }
    
    /**
     * Destination key for a source object: the configured prefix followed by the source basename.
     * The key is deterministic, so re-processing the same source overwrites the same object.
     * @param sourceBasename last path segment of the decoded source key
     * @return key within the destination bucket
     */
    public String destinationKeyFor(String sourceBasename) {
        String prefix = destinationKeyPrefix == null ? "" : destinationKeyPrefix;
        return prefix + sourceBasename;
    }
}
