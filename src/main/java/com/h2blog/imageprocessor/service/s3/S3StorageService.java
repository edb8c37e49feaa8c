package com.h2blog.imageprocessor.service.s3;

import com.h2blog.imageprocessor.exception.ObjectNotFoundException;
import com.h2blog.imageprocessor.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.List;

/**
 * {@link ObjectStorage} backed by a single S3 bucket.
 */
@Slf4j
@Service
public class S3StorageService implements ObjectStorage {

    private final S3Client s3Client;
    private final String bucketName;

    public S3StorageService(final S3Client s3Client, @Value("${aws.s3.bucket}") final String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        log.info("S3StorageService initialized for bucket '{}'.", bucketName);
    }

    @Override
    public byte[] getObject(final String path) {
        log.debug("Downloading object from S3 key: {}", path);
        final GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(path)
                .build();
        try {
            return s3Client.getObjectAsBytes(request).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new ObjectNotFoundException("No object found at S3 key: " + path, e);
        } catch (SdkException e) {
            throw new StorageException("Failed to download S3 key: " + path, e);
        }
    }

    @Override
    public void putObject(final String path, final byte[] content) {
        log.debug("Uploading {} bytes to S3 key: {}", content.length, path);
        final PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(path)
                .contentLength((long) content.length)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new StorageException("Failed to upload S3 key: " + path, e);
        }
        log.info("Successfully uploaded object to S3 key: {}", path);
    }

    @Override
    public void deleteObject(final String path) {
        log.debug("Deleting object from S3 key: {}", path);
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(path).build());
        } catch (SdkException e) {
            throw new StorageException("Failed to delete S3 key: " + path, e);
        }
    }

    @Override
    public void renameObject(final String oldPath, final String newPath) {
        log.info("Renaming S3 object from '{}' to '{}'", oldPath, newPath);
        final CopyObjectRequest copyReq = CopyObjectRequest.builder()
                .sourceBucket(bucketName)
                .sourceKey(oldPath)
                .destinationBucket(bucketName)
                .destinationKey(newPath)
                .build();
        try {
            s3Client.copyObject(copyReq);
        } catch (NoSuchKeyException e) {
            throw new ObjectNotFoundException("No object found at S3 key: " + oldPath, e);
        } catch (SdkException e) {
            throw new StorageException("Failed to copy S3 key '" + oldPath + "' to '" + newPath + "'", e);
        }
        deleteObject(oldPath);
    }

    @Override
    public List<String> listObjects(final String prefix) {
        final ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucketName)
                .prefix(prefix)
                .build();
        try {
            // the paginator follows continuation tokens
            return s3Client.listObjectsV2Paginator(request).contents().stream()
                    .map(S3Object::key)
                    .toList();
        } catch (SdkException e) {
            throw new StorageException("Failed to list S3 prefix: " + prefix, e);
        }
    }
}
