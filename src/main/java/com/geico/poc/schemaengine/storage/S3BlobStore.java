package com.geico.poc.schemaengine.storage;

import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Blob store on an S3 bucket (or any S3-compatible endpoint)
 */
public class S3BlobStore implements BlobStore {

    private static final String CONTENT_TYPE = "application/json";

    private final S3Client s3;
    private final String bucket;

    public S3BlobStore(S3Client s3, String bucket) {
        this.s3 = s3;
        this.bucket = bucket;
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalStateException("S3 bucket not configured: schema-engine.blob.s3.bucket");
        }
    }

    @Override
    public void put(String key, String content) {
        final String k = BlobStore.normalize(key);
        try {
            PutObjectRequest req = PutObjectRequest.builder()
                .bucket(bucket)
                .key(k)
                .contentType(CONTENT_TYPE)
                .build();
            s3.putObject(req, RequestBody.fromString(content, StandardCharsets.UTF_8));
        } catch (S3Exception e) {
            throw wrap("PUT", k, e);
        } catch (SdkClientException e) {
            throw new BlobStorageException(BlobStorageException.msg("s3", "PUT", k, e.getMessage()), e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        final String k = BlobStore.normalize(key);
        try {
            return Optional.of(s3.getObject(
                    GetObjectRequest.builder().bucket(bucket).key(k).build(),
                    ResponseTransformer.toBytes())
                .asUtf8String());
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            throw wrap("GET", k, e);
        } catch (SdkClientException e) {
            throw new BlobStorageException(BlobStorageException.msg("s3", "GET", k, e.getMessage()), e);
        }
    }

    @Override
    public boolean delete(String key) {
        final String k = BlobStore.normalize(key);
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(k).build());
            return true;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw wrap("DELETE", k, e);
        } catch (SdkClientException e) {
            throw new BlobStorageException(BlobStorageException.msg("s3", "DELETE", k, e.getMessage()), e);
        }
    }

    @Override
    public void deletePrefix(String prefix) {
        final String p = BlobStore.normalize(prefix);
        List<String> keys = list(p);
        try {
            for (int i = 0; i < keys.size(); i += 1000) {
                List<ObjectIdentifier> dels = keys.subList(i, Math.min(i + 1000, keys.size())).stream()
                    .map(key -> ObjectIdentifier.builder().key(key).build())
                    .toList();
                s3.deleteObjects(DeleteObjectsRequest.builder()
                    .bucket(bucket)
                    .delete(Delete.builder().objects(dels).build())
                    .build());
            }
        } catch (S3Exception e) {
            throw wrap("DELETE_PREFIX", p, e);
        } catch (SdkClientException e) {
            throw new BlobStorageException(BlobStorageException.msg("s3", "DELETE_PREFIX", p, e.getMessage()), e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        final String p = BlobStore.normalize(prefix);
        List<String> keys = new ArrayList<>();
        String token = null;
        try {
            do {
                ListObjectsV2Request req = ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(p)
                    .maxKeys(1000)
                    .continuationToken(token)
                    .build();
                ListObjectsV2Response resp = s3.listObjectsV2(req);
                resp.contents().stream().map(S3Object::key).forEach(keys::add);
                token = Boolean.TRUE.equals(resp.isTruncated()) ? resp.nextContinuationToken() : null;
            } while (token != null);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return List.of();
            }
            throw wrap("LIST", p, e);
        } catch (SdkClientException e) {
            throw new BlobStorageException(BlobStorageException.msg("s3", "LIST", p, e.getMessage()), e);
        }
        keys.sort(null);
        return keys;
    }

    private static BlobStorageException wrap(String op, String key, S3Exception e) {
        String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
        return new BlobStorageException(
            BlobStorageException.msg("s3", op, key, "status " + e.statusCode() + ": " + detail), e);
    }
}
