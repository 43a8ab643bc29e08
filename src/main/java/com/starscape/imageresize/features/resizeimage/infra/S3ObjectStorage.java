package com.starscape.imageresize.features.resizeimage.infra;

import com.starscape.imageresize.features.resizeimage.domain.ObjectLocation;
import com.starscape.imageresize.features.resizeimage.domain.ObjectStorage;
import com.starscape.imageresize.features.resizeimage.domain.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Object storage on S3. SDK errors are translated into {@link StorageException}s.
 */
@Service
public class S3ObjectStorage implements ObjectStorage {
    
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStorage.class);
    
    private final S3Client s3Client;
    
    public S3ObjectStorage(S3Client s3Client) {
        this.s3Client = s3Client;
    }
    
    @Override
    public byte[] fetch(ObjectLocation location) {
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(location.bucket())
                .key(location.key())
                .build();
        
        try (ResponseInputStream<GetObjectResponse> response = s3Client.getObject(getRequest)) {
            byte[] bytes = response.readAllBytes();
            log.debug("Fetched {} bytes from {}", bytes.length, location);
            return bytes;
        } catch (SdkException e) {
            throw translate("fetch", location, e);
        } catch (IOException e) {
            throw new StorageException(StorageException.Reason.UNAVAILABLE, location,
                    "Failed to read " + location + ": " + e.getMessage(), e);
        }
    }
    
    @Override
    public void store(ObjectLocation location, Path content, String contentType, Map<String, String> metadata) {
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(location.bucket())
                .key(location.key())
                .contentType(contentType)
                .metadata(metadata)
                .build();
        
        try {
            s3Client.putObject(putRequest, RequestBody.fromFile(content));
            log.debug("Stored {} as {}", content.getFileName(), location);
        } catch (SdkException e) {
            throw translate("store", location, e);
        }
    }
    
    private StorageException translate(String operation, ObjectLocation location, SdkException e) {
        StorageException.Reason reason = StorageException.Reason.UNAVAILABLE;
        if (e instanceof NoSuchKeyException || e instanceof NoSuchBucketException) {
            reason = StorageException.Reason.NOT_FOUND;
        } else if (e instanceof S3Exception s3e) {
            if (s3e.statusCode() == 404) {
                reason = StorageException.Reason.NOT_FOUND;
            } else if (s3e.statusCode() == 403) {
                reason = StorageException.Reason.ACCESS_DENIED;
            }
        }
        return new StorageException(reason, location,
                "Failed to " + operation + " " + location + " (" + reason + "): " + e.getMessage(), e);
    }
}
