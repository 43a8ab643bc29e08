package com.starscape.imageresize.features.resizeimage.infra;

import com.starscape.imageresize.features.resizeimage.domain.ObjectLocation;
import com.starscape.imageresize.features.resizeimage.domain.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class S3ObjectStorageTest {
    
    private static final ObjectLocation SOURCE = new ObjectLocation("src-bucket-image-in", "my photo.jpg");
    
    @TempDir
    Path tempDir;
    
    private S3Client s3Client;
    private S3ObjectStorage storage;
    
    @BeforeEach
    void setUp() {
        s3Client = mock(S3Client.class);
        storage = new S3ObjectStorage(s3Client);
    }
    
    @Test
    void shouldFetchObjectBytesWithLiteralKey() {
        byte[] content = {1, 2, 3, 4};
        when(s3Client.getObject(any(GetObjectRequest.class))).thenReturn(new ResponseInputStream<>(
                GetObjectResponse.builder().contentLength(4L).build(),
                AbortableInputStream.create(new ByteArrayInputStream(content))));
        
        byte[] fetched = storage.fetch(SOURCE);
        
        assertArrayEquals(content, fetched);
        ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObject(captor.capture());
        assertEquals("src-bucket-image-in", captor.getValue().bucket());
        assertEquals("my photo.jpg", captor.getValue().key());
    }
    
    @Test
    void shouldTranslateMissingKeyToNotFound() {
        when(s3Client.getObject(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("The specified key does not exist.").build());
        
        StorageException e = assertThrows(StorageException.class, () -> storage.fetch(SOURCE));
        
        assertEquals(StorageException.Reason.NOT_FOUND, e.getReason());
        assertEquals(SOURCE, e.getLocation());
    }
    
    @Test
    void shouldTranslateForbiddenToAccessDenied() {
        when(s3Client.getObject(any(GetObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("Access Denied").build());
        
        StorageException e = assertThrows(StorageException.class, () -> storage.fetch(SOURCE));
        
        assertEquals(StorageException.Reason.ACCESS_DENIED, e.getReason());
    }
    
    @Test
    void shouldTranslateClientErrorsToUnavailable() {
        when(s3Client.getObject(any(GetObjectRequest.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));
        
        StorageException e = assertThrows(StorageException.class, () -> storage.fetch(SOURCE));
        
        assertEquals(StorageException.Reason.UNAVAILABLE, e.getReason());
    }
    
    @Test
    void shouldStoreWithContentTypeAndMetadata() throws Exception {
        Path file = Files.write(tempDir.resolve("resized"), new byte[] {9, 9});
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());
        Map<String, String> metadata = Map.of("original_filename", "my photo.jpg", "resized_dimensions", "10x5");
        
        storage.store(new ObjectLocation("dest-bucket-image-out", "resized-my photo.jpg"), file, "image/jpeg", metadata);
        
        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        PutObjectRequest request = captor.getValue();
        assertEquals("dest-bucket-image-out", request.bucket());
        assertEquals("resized-my photo.jpg", request.key());
        assertEquals("image/jpeg", request.contentType());
        assertEquals(metadata, request.metadata());
    }
    
    @Test
    void shouldTranslateStoreFailure() throws Exception {
        Path file = Files.write(tempDir.resolve("resized"), new byte[] {9});
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("Access Denied").build());
        
        StorageException e = assertThrows(StorageException.class, () -> storage.store(
                new ObjectLocation("dest-bucket-image-out", "resized-a.jpg"), file, "image/jpeg", Map.of()));
        
        assertEquals(StorageException.Reason.ACCESS_DENIED, e.getReason());
    }
}
