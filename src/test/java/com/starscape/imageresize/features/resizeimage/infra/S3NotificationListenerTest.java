package com.starscape.imageresize.features.resizeimage.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.imageresize.features.resizeimage.app.NotificationBatchCoordinator;
import com.starscape.imageresize.features.resizeimage.domain.BatchAbortedException;
import com.starscape.imageresize.features.resizeimage.domain.BatchSummary;
import com.starscape.imageresize.features.resizeimage.domain.FailureKind;
import com.starscape.imageresize.features.resizeimage.domain.ImageDecodeException;
import com.starscape.imageresize.features.resizeimage.domain.NotificationRecord;
import com.starscape.imageresize.features.resizeimage.domain.ObjectLocation;
import com.starscape.imageresize.features.resizeimage.domain.RecordOutcome;
import com.starscape.imageresize.features.resizeimage.infra.events.InvocationResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class S3NotificationListenerTest {
    
    private static final String NOTIFICATION = """
            {
              "Records": [
                {
                  "eventVersion": "2.1",
                  "eventSource": "aws:s3",
                  "awsRegion": "eu-west-1",
                  "eventTime": "2024-05-01T12:00:00.000Z",
                  "eventName": "ObjectCreated:Put",
                  "userIdentity": { "principalId": "AWS:EXAMPLE" },
                  "s3": {
                    "s3SchemaVersion": "1.0",
                    "configurationId": "resize-trigger",
                    "bucket": { "name": "src-bucket-image-in", "arn": "arn:aws:s3:::src-bucket-image-in" },
                    "object": { "key": "my+photo.jpg", "size": 1024, "eTag": "abc", "sequencer": "0055AED6DCD90281E5" }
                  }
                },
                {
                  "eventVersion": "2.1",
                  "eventSource": "aws:s3",
                  "awsRegion": "eu-west-1",
                  "eventTime": "2024-05-01T12:00:01.000Z",
                  "eventName": "ObjectCreated:CompleteMultipartUpload",
                  "s3": {
                    "bucket": { "name": "src-bucket-image-in" },
                    "object": { "key": "nested/dir/big.png" }
                  }
                }
              ]
            }
            """;
    
    private NotificationBatchCoordinator coordinator;
    private S3NotificationListener listener;
    private final ObjectMapper objectMapper = new ObjectMapper();
    
    @BeforeEach
    void setUp() {
        coordinator = mock(NotificationBatchCoordinator.class);
        listener = new S3NotificationListener(coordinator, objectMapper);
    }
    
    @Test
    @SuppressWarnings("unchecked")
    void shouldMapNotificationRecordsInOrder() {
        when(coordinator.process(anyList())).thenReturn(BatchSummary.of(List.of()));
        
        listener.handle(NOTIFICATION);
        
        ArgumentCaptor<List<NotificationRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(coordinator).process(captor.capture());
        List<NotificationRecord> records = captor.getValue();
        
        assertEquals(2, records.size());
        NotificationRecord first = records.get(0);
        assertEquals(new ObjectLocation("src-bucket-image-in", "my+photo.jpg"), first.source());
        assertEquals(new ObjectLocation("src-bucket-image-in", "my photo.jpg"), first.decodedSource());
        assertEquals(1024L, first.sizeHint());
        assertEquals("ObjectCreated:Put", first.eventName());
        assertEquals("eu-west-1", first.region());
        assertEquals("2.1", first.eventVersion());
        
        NotificationRecord second = records.get(1);
        assertEquals("nested/dir/big.png", second.source().key());
        assertNull(second.sizeHint());
    }
    
    @Test
    void shouldReturnStatusAndProcessedCount() throws Exception {
        NotificationRecord record = new NotificationRecord(new ObjectLocation("b", "k"), null,
                "ObjectCreated:Put", null, null, null, null);
        when(coordinator.process(anyList())).thenReturn(BatchSummary.of(List.of(
                new RecordOutcome.Skipped(record, "test"))));
        
        InvocationResponse response = listener.handle(NOTIFICATION);
        
        assertEquals(200, response.statusCode());
        String json = objectMapper.writeValueAsString(response);
        assertTrue(json.contains("\"processed_count\":0"), json);
        assertTrue(json.contains("\"message\":\"Image processing completed successfully\""), json);
    }
    
    @Test
    void shouldTreatTestEventAsEmptyBatch() {
        when(coordinator.process(anyList())).thenReturn(BatchSummary.of(List.of()));
        
        listener.handle("""
                {"Service":"Amazon S3","Event":"s3:TestEvent","Time":"2024-05-01T12:00:00.000Z","Bucket":"src-bucket-image-in"}
                """);
        
        verify(coordinator).process(List.of());
    }
    
    @Test
    void shouldRejectInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> listener.handle("not json"));
        verifyNoInteractions(coordinator);
    }
    
    @Test
    void shouldRethrowAbortedBatch() {
        NotificationRecord record = new NotificationRecord(new ObjectLocation("b", "k.jpg"), null,
                "ObjectCreated:Put", null, null, null, null);
        BatchAbortedException aborted = new BatchAbortedException(
                new RecordOutcome.Failure(record, FailureKind.DECODE, new ImageDecodeException("bad")), 0, 1);
        when(coordinator.process(anyList())).thenThrow(aborted);
        
        BatchAbortedException thrown = assertThrows(BatchAbortedException.class, () -> listener.handle(NOTIFICATION));
        assertSame(aborted, thrown);
    }
}
