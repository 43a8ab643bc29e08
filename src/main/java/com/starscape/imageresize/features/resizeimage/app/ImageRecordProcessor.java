package com.starscape.imageresize.features.resizeimage.app;

import com.starscape.imageresize.common.config.ProcessingProperties;
import com.starscape.imageresize.features.resizeimage.domain.AuditRecord;
import com.starscape.imageresize.features.resizeimage.domain.AuditStore;
import com.starscape.imageresize.features.resizeimage.domain.DecodedImage;
import com.starscape.imageresize.features.resizeimage.domain.DegenerateMetadataException;
import com.starscape.imageresize.features.resizeimage.domain.DerivedMetrics;
import com.starscape.imageresize.features.resizeimage.domain.FailureKind;
import com.starscape.imageresize.features.resizeimage.domain.ImageMetadata;
import com.starscape.imageresize.features.resizeimage.domain.ImageProcessingException;
import com.starscape.imageresize.features.resizeimage.domain.NotificationRecord;
import com.starscape.imageresize.features.resizeimage.domain.ObjectLocation;
import com.starscape.imageresize.features.resizeimage.domain.ObjectStorage;
import com.starscape.imageresize.features.resizeimage.domain.RasterCodec;
import com.starscape.imageresize.features.resizeimage.domain.RecordOutcome;
import com.starscape.imageresize.features.resizeimage.domain.ResizeResult;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the full pipeline for one notification record:
 * - Fetches the source object into a temporary file
 * - Extracts metadata of the original
 * - Resizes and re-encodes in the original format, or PNG where that format cannot hold the pixels
 * - Stores the resized object with descriptive metadata
 * - Appends an audit record
 * Temporary files are removed on every exit path. Failures are returned as
 * {@link RecordOutcome.Failure}, never thrown.
 */
@Service
public class ImageRecordProcessor {
    
    private static final Logger log = LoggerFactory.getLogger(ImageRecordProcessor.class);
    
    private final ObjectStorage objectStorage;
    private final AuditStore auditStore;
    private final RasterCodec codec;
    private final ImageMetadataExtractor metadataExtractor;
    private final ImageResizer resizer;
    private final DerivedMetricsCalculator metricsCalculator;
    private final ProcessingProperties properties;
    private final Clock clock;
    
    public ImageRecordProcessor(
            ObjectStorage objectStorage,
            AuditStore auditStore,
            RasterCodec codec,
            ImageMetadataExtractor metadataExtractor,
            ImageResizer resizer,
            DerivedMetricsCalculator metricsCalculator,
            ProcessingProperties properties,
            Clock clock) {
        if (properties.getDestinationBucket() == null || properties.getDestinationBucket().isBlank()) {
            throw new IllegalStateException("app.processing.destination-bucket must be configured");
        }
        this.objectStorage = objectStorage;
        this.auditStore = auditStore;
        this.codec = codec;
        this.metadataExtractor = metadataExtractor;
        this.resizer = resizer;
        this.metricsCalculator = metricsCalculator;
        this.properties = properties;
        this.clock = clock;
    }
    
    public RecordOutcome process(NotificationRecord record) {
        ObjectLocation source;
        try {
            source = record.decodedSource();
        } catch (IllegalArgumentException e) {
            log.error("Cannot decode object key of {}: {}", record.source(), e.getMessage());
            return new RecordOutcome.Failure(record, FailureKind.INVALID_RECORD, e);
        }
        
        Optional<String> skipReason = skipReason(record, source);
        if (skipReason.isPresent()) {
            log.info("Skipping {}: {}", source, skipReason.get());
            return new RecordOutcome.Skipped(record, skipReason.get());
        }
        
        log.info("Processing image: bucket={}, key={}, event={}, sizeHint={}",
                source.bucket(), source.key(), record.eventName(), record.sizeHint());
        
        try (TemporaryArtifact originalFile = TemporaryArtifact.in(properties.getWorkDirectory(), "original");
             TemporaryArtifact resizedFile = TemporaryArtifact.in(properties.getWorkDirectory(), "resized")) {
            
            AuditRecord audit = transform(record, source, originalFile, resizedFile);
            log.info("Successfully processed {}. Original: {} bytes, Resized: {} bytes",
                    source.key(), audit.originalMetadata().sizeBytes(), audit.resizedMetadata().sizeBytes());
            return new RecordOutcome.Success(record, audit);
            
        } catch (ImageProcessingException e) {
            log.error("Error processing {} ({}): {}", source, e.kind(), e.getMessage(), e);
            return new RecordOutcome.Failure(record, e.kind(), e);
        } catch (IOException | RuntimeException e) {
            log.error("Unexpected error processing {}", source, e);
            return new RecordOutcome.Failure(record, FailureKind.UNEXPECTED, e);
        }
    }
    
    private AuditRecord transform(
            NotificationRecord record,
            ObjectLocation source,
            TemporaryArtifact originalFile,
            TemporaryArtifact resizedFile) throws IOException {
        
        byte[] sourceBytes = objectStorage.fetch(source);
        if (sourceBytes.length == 0) {
            throw new DegenerateMetadataException("Source object " + source + " is empty");
        }
        Files.write(originalFile.path(), sourceBytes);
        String checksum = DigestUtils.sha256Hex(sourceBytes);
        
        DecodedImage decoded = codec.decode(originalFile.path());
        ImageMetadata originalMetadata = metadataExtractor.extract(decoded, originalFile.size());
        
        ResizeResult resizeResult = resizer.resize(decoded.raster());
        String writtenFormat = codec.encode(resizeResult.raster(), decoded.format(), resizedFile.path());
        if (!writtenFormat.equalsIgnoreCase(decoded.format())) {
            log.info("Resized {} written as {} instead of {}", source.key(), writtenFormat, decoded.format());
        }
        ImageMetadata resizedMetadata = metadataExtractor.extract(resizedFile.path());
        
        DerivedMetrics metrics = metricsCalculator.calculate(originalMetadata, resizedMetadata);
        
        Instant processingTime = clock.instant();
        ObjectLocation destination = new ObjectLocation(
                properties.getDestinationBucket(),
                properties.destinationKeyFor(source.basename()));
        objectStorage.store(destination, resizedFile.path(), contentTypeFor(writtenFormat), Map.of(
                "original_filename", source.basename(),
                "original_bucket", source.bucket(),
                "resized_dimensions", resizeResult.target().toString(),
                "processing_time", processingTime.toString()));
        log.debug("Stored resized image: {} ({})", destination, metrics.dimensionChange());
        
        AuditRecord audit = new AuditRecord(
                UUID.randomUUID().toString(),
                record,
                source,
                originalMetadata,
                checksum,
                destination,
                resizedMetadata,
                metrics,
                processingTime);
        auditStore.put(audit);
        return audit;
    }
    
    /**
     * Records that must not be processed: anything but object creation, and objects this
     * pipeline wrote itself (which would otherwise loop when source and destination bucket match).
     */
    private Optional<String> skipReason(NotificationRecord record, ObjectLocation source) {
        if (!record.isObjectCreated()) {
            return Optional.of("not an object-created event: " + record.eventName());
        }
        String prefix = properties.getDestinationKeyPrefix();
        if (source.bucket().equals(properties.getDestinationBucket())
                && prefix != null && !prefix.isEmpty()
                && source.basename().startsWith(prefix)) {
            return Optional.of("object is a resized output");
        }
        return Optional.empty();
    }
    
    private String contentTypeFor(String format) {
        return switch (format.toUpperCase(Locale.ROOT)) {
            case "JPEG" -> "image/jpeg";
            case "PNG" -> "image/png";
            case "GIF" -> "image/gif";
            case "BMP" -> "image/bmp";
            case "TIFF" -> "image/tiff";
            case "WEBP" -> "image/webp";
            default -> "application/octet-stream";
        };
    }
}
