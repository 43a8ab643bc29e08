package com.starscape.imageresize.features.resizeimage.infra;

import com.starscape.imageresize.features.resizeimage.domain.AuditRecord;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Item written to the audit table, one per processed object.
 * Attribute names follow the existing table layout; widths, heights, sizes and the reduction
 * percentage are numbers.
 */
@DynamoDbBean
public class AuditItem {
    
    public static final String PARTITION_KEY = "resource-id";
    
    private String resourceId;
    private String eventTime;
    private String eventType;
    private String originalBucket;
    private String originalObjectKey;
    private Long originalSize;
    private Integer originalWidth;
    private Integer originalHeight;
    private String originalFormat;
    private String originalMode;
    private Long originalFileSize;
    private String originalChecksum;
    private String resizedBucket;
    private String resizedObjectKey;
    private Integer resizedWidth;
    private Integer resizedHeight;
    private String resizedFormat;
    private String resizedMode;
    private Long resizedFileSize;
    private String processingTime;
    private Integer reductionPercentage;
    private String dimensionReduction;
    private String eventSource;
    private String awsRegion;
    private String eventVersion;
    
    public AuditItem() {
    }
    
    /**
     * Flattens a completed transformation. {@code OriginalSize} is the notification size hint,
     * {@code -1} when none was delivered.
     */
    public static AuditItem from(AuditRecord record) {
        AuditItem item = new AuditItem();
        item.setResourceId(record.resourceId());
        item.setEventTime(nullToEmpty(record.event().eventTime()));
        item.setEventType(nullToEmpty(record.event().eventName()));
        
        item.setOriginalBucket(record.original().bucket());
        item.setOriginalObjectKey(record.original().key());
        item.setOriginalSize(record.event().sizeHint() != null ? record.event().sizeHint() : -1L);
        item.setOriginalWidth(record.originalMetadata().width());
        item.setOriginalHeight(record.originalMetadata().height());
        item.setOriginalFormat(record.originalMetadata().format());
        item.setOriginalMode(record.originalMetadata().colorMode());
        item.setOriginalFileSize(record.originalMetadata().sizeBytes());
        item.setOriginalChecksum(record.originalChecksum());
        
        item.setResizedBucket(record.resized().bucket());
        item.setResizedObjectKey(record.resized().key());
        item.setResizedWidth(record.resizedMetadata().width());
        item.setResizedHeight(record.resizedMetadata().height());
        item.setResizedFormat(record.resizedMetadata().format());
        item.setResizedMode(record.resizedMetadata().colorMode());
        item.setResizedFileSize(record.resizedMetadata().sizeBytes());
        
        item.setProcessingTime(record.processingTime().toString());
        item.setReductionPercentage(record.metrics().reductionPercentage());
        item.setDimensionReduction(record.metrics().dimensionChange());
        
        item.setEventSource(record.event().eventSource() != null ? record.event().eventSource() : "aws:s3");
        item.setAwsRegion(nullToEmpty(record.event().region()));
        item.setEventVersion(nullToEmpty(record.event().eventVersion()));
        return item;
    }
    
    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
    
    // ---------- DynamoDB mapping ----------
    
    @DynamoDbPartitionKey
    @DynamoDbAttribute(PARTITION_KEY)
    public String getResourceId() {
        return resourceId;
    }
    
    public void setResourceId(String resourceId) {
        this.resourceId = resourceId;
    }
    
    @DynamoDbAttribute("EventTime")
    public String getEventTime() {
        return eventTime;
    }
    
    public void setEventTime(String eventTime) {
        this.eventTime = eventTime;
    }
    
    @DynamoDbAttribute("EventType")
    public String getEventType() {
        return eventType;
    }
    
    public void setEventType(String eventType) {
        this.eventType = eventType;
    }
    
    @DynamoDbAttribute("OriginalBucket")
    public String getOriginalBucket() {
        return originalBucket;
    }
    
    public void setOriginalBucket(String originalBucket) {
        this.originalBucket = originalBucket;
    }
    
    @DynamoDbAttribute("OriginalObjectKey")
    public String getOriginalObjectKey() {
        return originalObjectKey;
    }
    
    public void setOriginalObjectKey(String originalObjectKey) {
        this.originalObjectKey = originalObjectKey;
    }
    
    @DynamoDbAttribute("OriginalSize")
    public Long getOriginalSize() {
        return originalSize;
    }
    
    public void setOriginalSize(Long originalSize) {
        this.originalSize = originalSize;
    }
    
    @DynamoDbAttribute("OriginalWidth")
    public Integer getOriginalWidth() {
        return originalWidth;
    }
    
    public void setOriginalWidth(Integer originalWidth) {
        this.originalWidth = originalWidth;
    }
    
    @DynamoDbAttribute("OriginalHeight")
    public Integer getOriginalHeight() {
        return originalHeight;
    }
    
    public void setOriginalHeight(Integer originalHeight) {
        this.originalHeight = originalHeight;
    }
    
    @DynamoDbAttribute("OriginalFormat")
    public String getOriginalFormat() {
        return originalFormat;
    }
    
    public void setOriginalFormat(String originalFormat) {
        this.originalFormat = originalFormat;
    }
    
    @DynamoDbAttribute("OriginalMode")
    public String getOriginalMode() {
        return originalMode;
    }
    
    public void setOriginalMode(String originalMode) {
        this.originalMode = originalMode;
    }
    
    @DynamoDbAttribute("OriginalFileSize")
    public Long getOriginalFileSize() {
        return originalFileSize;
    }
    
    public void setOriginalFileSize(Long originalFileSize) {
        this.originalFileSize = originalFileSize;
    }
    
    @DynamoDbAttribute("OriginalChecksum")
    public String getOriginalChecksum() {
        return originalChecksum;
    }
    
    public void setOriginalChecksum(String originalChecksum) {
        this.originalChecksum = originalChecksum;
    }
    
    @DynamoDbAttribute("ResizedBucket")
    public String getResizedBucket() {
        return resizedBucket;
    }
    
    public void setResizedBucket(String resizedBucket) {
        this.resizedBucket = resizedBucket;
    }
    
    @DynamoDbAttribute("ResizedObjectKey")
    public String getResizedObjectKey() {
        return resizedObjectKey;
    }
    
    public void setResizedObjectKey(String resizedObjectKey) {
        this.resizedObjectKey = resizedObjectKey;
    }
    
    @DynamoDbAttribute("ResizedWidth")
    public Integer getResizedWidth() {
        return resizedWidth;
    }
    
    public void setResizedWidth(Integer resizedWidth) {
        this.resizedWidth = resizedWidth;
    }
    
    @DynamoDbAttribute("ResizedHeight")
    public Integer getResizedHeight() {
        return resizedHeight;
    }
    
    public void setResizedHeight(Integer resizedHeight) {
        this.resizedHeight = resizedHeight;
    }
    
    @DynamoDbAttribute("ResizedFormat")
    public String getResizedFormat() {
        return resizedFormat;
    }
    
    public void setResizedFormat(String resizedFormat) {
        this.resizedFormat = resizedFormat;
    }
    
    @DynamoDbAttribute("ResizedMode")
    public String getResizedMode() {
        return resizedMode;
    }
    
    public void setResizedMode(String resizedMode) {
        this.resizedMode = resizedMode;
    }
    
    @DynamoDbAttribute("ResizedFileSize")
    public Long getResizedFileSize() {
        return resizedFileSize;
    }
    
    public void setResizedFileSize(Long resizedFileSize) {
        this.resizedFileSize = resizedFileSize;
    }
    
    @DynamoDbAttribute("ProcessingTime")
    public String getProcessingTime() {
        return processingTime;
    }
    
    public void setProcessingTime(String processingTime) {
        this.processingTime = processingTime;
    }
    
    @DynamoDbAttribute("ReductionPercentage")
    public Integer getReductionPercentage() {
        return reductionPercentage;
    }
    
    public void setReductionPercentage(Integer reductionPercentage) {
        this.reductionPercentage = reductionPercentage;
    }
    
    @DynamoDbAttribute("DimensionReduction")
    public String getDimensionReduction() {
        return dimensionReduction;
    }
    
    public void setDimensionReduction(String dimensionReduction) {
        this.dimensionReduction = dimensionReduction;
    }
    
    @DynamoDbAttribute("EventSource")
    public String getEventSource() {
        return eventSource;
    }
    
    public void setEventSource(String eventSource) {
        this.eventSource = eventSource;
    }
    
    @DynamoDbAttribute("AWSRegion")
    public String getAwsRegion() {
        return awsRegion;
    }
    
    public void setAwsRegion(String awsRegion) {
        this.awsRegion = awsRegion;
    }
    
    @DynamoDbAttribute("EventVersion")
    public String getEventVersion() {
        return eventVersion;
    }
    
    public void setEventVersion(String eventVersion) {
        this.eventVersion = eventVersion;
    }
}
