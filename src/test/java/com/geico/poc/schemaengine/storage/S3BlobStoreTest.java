package com.geico.poc.schemaengine.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the S3 blob store against a mocked client
 */
public class S3BlobStoreTest {

    private S3Client s3;
    private S3BlobStore store;

    @BeforeEach
    public void setup() {
        s3 = mock(S3Client.class);
        store = new S3BlobStore(s3, "snapshots-bucket");
    }

    private static S3Exception status(int code) {
        return (S3Exception) S3Exception.builder().statusCode(code).message("status " + code).build();
    }

    @Test
    public void testBucketRequired() {
        assertThrows(IllegalStateException.class, () -> new S3BlobStore(s3, " "));
    }

    @Test
    public void testPutStripsLeadingSlash() {
        store.put("/snapshots/a/data.json", "{}");

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3).putObject(captor.capture(), any(RequestBody.class));
        assertEquals("snapshots-bucket", captor.getValue().bucket());
        assertEquals("snapshots/a/data.json", captor.getValue().key());
        assertEquals("application/json", captor.getValue().contentType());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testGetReturnsContent() {
        ResponseBytes<GetObjectResponse> bytes = ResponseBytes.fromByteArray(
            GetObjectResponse.builder().build(), "{\"ok\":true}".getBytes(StandardCharsets.UTF_8));
        when(s3.getObject(any(GetObjectRequest.class), any(ResponseTransformer.class))).thenReturn(bytes);

        assertEquals("{\"ok\":true}", store.get("snapshots/a/data.json").orElseThrow());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testGetMissingKeyIsEmpty() {
        when(s3.getObject(any(GetObjectRequest.class), any(ResponseTransformer.class))).thenThrow(status(404));

        assertTrue(store.get("snapshots/a/data.json").isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testServerErrorIsWrapped() {
        when(s3.getObject(any(GetObjectRequest.class), any(ResponseTransformer.class))).thenThrow(status(500));

        BlobStorageException e = assertThrows(BlobStorageException.class, () -> store.get("k"));
        assertTrue(e.getMessage().contains("status 500"), e.getMessage());
    }

    @Test
    public void testDeleteMissingKeyReturnsFalse() {
        when(s3.deleteObject(any(DeleteObjectRequest.class))).thenThrow(status(404));

        assertFalse(store.delete("snapshots/a/data.json"));
    }

    @Test
    public void testListFollowsContinuationTokens() {
        ListObjectsV2Response first = ListObjectsV2Response.builder()
            .contents(S3Object.builder().key("snapshots/b/data.json").build())
            .isTruncated(true)
            .nextContinuationToken("t1")
            .build();
        ListObjectsV2Response second = ListObjectsV2Response.builder()
            .contents(S3Object.builder().key("snapshots/a/data.json").build())
            .isTruncated(false)
            .build();
        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(first, second);

        assertEquals(List.of("snapshots/a/data.json", "snapshots/b/data.json"), store.list("snapshots/"));

        ArgumentCaptor<ListObjectsV2Request> captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3, times(2)).listObjectsV2(captor.capture());
        assertNull(captor.getAllValues().get(0).continuationToken());
        assertEquals("t1", captor.getAllValues().get(1).continuationToken());
    }

    @Test
    public void testDeletePrefixBatchesListedKeys() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
            .contents(
                S3Object.builder().key("snapshots/a/data.json").build(),
                S3Object.builder().key("snapshots/a/schema.json").build())
            .isTruncated(false)
            .build());

        store.deletePrefix("snapshots/a/");

        ArgumentCaptor<DeleteObjectsRequest> captor = ArgumentCaptor.forClass(DeleteObjectsRequest.class);
        verify(s3).deleteObjects(captor.capture());
        assertEquals(2, captor.getValue().delete().objects().size());
    }
}
