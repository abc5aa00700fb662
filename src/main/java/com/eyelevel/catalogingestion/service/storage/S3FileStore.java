package com.eyelevel.catalogingestion.service.storage;

import com.eyelevel.catalogingestion.exception.FileStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link FileStore} backed by an S3 bucket. Keys map one to one to object keys.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.ingestion.storage", name = "type", havingValue = "s3")
public class S3FileStore implements FileStore {

    private static final int DELETE_BATCH_SIZE = 1000;

    private final S3Client s3Client;
    private final String bucketName;

    public S3FileStore(final S3Client s3Client, @Value("${aws.s3.bucket}") final String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        log.info("S3FileStore initialized for bucket '{}'.", bucketName);
    }

    @Override
    @Retryable(retryFor = FileStoreException.class,
            maxAttemptsExpression = "#{${app.ingestion.storage.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.ingestion.storage.retry.delay-ms:500}}"),
            listeners = {"fileStoreRetryListener"})
    public void store(final String key, final InputStream content, final long contentLength) {
        try {
            s3Client.putObject(PutObjectRequest.builder().bucket(bucketName).key(key).build(),
                               RequestBody.fromInputStream(content, contentLength));
            log.info("Successfully uploaded object to S3 key: {}", key);
        } catch (SdkException e) {
            throw new FileStoreException("Failed to upload object to S3 key " + key, e);
        }
    }

    @Override
    @Retryable(retryFor = FileStoreException.class,
            maxAttemptsExpression = "#{${app.ingestion.storage.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.ingestion.storage.retry.delay-ms:500}}"),
            listeners = {"fileStoreRetryListener"})
    public void store(final String key, final byte[] content) {
        try {
            s3Client.putObject(PutObjectRequest.builder().bucket(bucketName).key(key).build(),
                               RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new FileStoreException("Failed to upload object to S3 key " + key, e);
        }
    }

    @Override
    public InputStream open(final String key) {
        log.debug("Downloading object from S3 key: {}", key);
        try {
            return s3Client.getObject(GetObjectRequest.builder().bucket(bucketName).key(key).build());
        } catch (SdkException e) {
            throw new FileStoreException("Failed to download S3 key " + key, e);
        }
    }

    @Override
    public boolean exists(final String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (SdkException e) {
            throw new FileStoreException("Failed to inspect S3 key " + key, e);
        }
    }

    @Override
    public boolean delete(final String key) {
        if (!exists(key)) {
            return false;
        }
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
            return true;
        } catch (SdkException e) {
            throw new FileStoreException("Failed to delete S3 key " + key, e);
        }
    }

    @Override
    public int deletePrefix(final String prefix) {
        final List<String> keys = listKeys(prefix);
        int deleted = 0;
        for (int start = 0; start < keys.size(); start += DELETE_BATCH_SIZE) {
            final List<ObjectIdentifier> batch = keys.subList(start, Math.min(keys.size(), start + DELETE_BATCH_SIZE))
                                                     .stream().map(key -> ObjectIdentifier.builder().key(key).build())
                                                     .toList();
            try {
                s3Client.deleteObjects(DeleteObjectsRequest.builder().bucket(bucketName)
                                                           .delete(Delete.builder().objects(batch).build()).build());
                deleted += batch.size();
            } catch (SdkException e) {
                throw new FileStoreException("Failed to delete objects under S3 prefix " + prefix, e);
            }
        }
        return deleted;
    }

    @Override
    public List<String> listKeys(final String prefix) {
        final List<String> keys = new ArrayList<>();
        try {
            s3Client.listObjectsV2Paginator(ListObjectsV2Request.builder().bucket(bucketName).prefix(prefix).build())
                    .contents().stream().map(S3Object::key).forEach(keys::add);
        } catch (SdkException e) {
            throw new FileStoreException("Failed to list S3 prefix " + prefix, e);
        }
        return keys;
    }
}
