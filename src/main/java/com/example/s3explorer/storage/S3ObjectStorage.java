package com.example.s3explorer.storage;

import com.example.s3explorer.StorageException;
import com.example.s3explorer.tree.ObjectSummary;
import com.example.s3explorer.tree.RawListing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.net.URI;
import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ObjectStorage} backed by an S3 bucket through the AWS SDK v2.
 */
public final class S3ObjectStorage implements ObjectStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStorage.class);
    private static final int LIST_PAGE_SIZE = 1000;

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final String bucket;

    public S3ObjectStorage(String bucket, Optional<String> region, Optional<URI> endpointOverride, boolean pathStyleAccess) {
        this(buildClient(region, endpointOverride, pathStyleAccess),
                buildPresigner(region, endpointOverride, pathStyleAccess),
                bucket);
    }

    S3ObjectStorage(S3Client s3Client, S3Presigner presigner, String bucket) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("bucket is required.");
        }
        this.s3Client = s3Client;
        this.presigner = presigner;
        this.bucket = bucket;
    }

    @Override
    public RawListing list(String prefix, String delimiter, int maxKeys) throws StorageException {
        String listPrefix = prefix == null ? "" : prefix;
        int limit = Math.max(1, maxKeys);
        List<String> commonPrefixes = new ArrayList<>();
        List<ObjectSummary> objects = new ArrayList<>();
        String continuationToken = null;
        boolean truncated = false;
        try {
            // Follow continuation tokens until the caller's limit is reached.
            while (commonPrefixes.size() + objects.size() < limit) {
                int remaining = limit - commonPrefixes.size() - objects.size();
                ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
                        .bucket(bucket)
                        .prefix(listPrefix)
                        .delimiter(delimiter)
                        .maxKeys(Math.min(LIST_PAGE_SIZE, remaining));
                if (continuationToken != null) {
                    request.continuationToken(continuationToken);
                }
                ListObjectsV2Response response = s3Client.listObjectsV2(request.build());
                for (CommonPrefix commonPrefix : response.commonPrefixes()) {
                    commonPrefixes.add(commonPrefix.prefix());
                }
                for (S3Object object : response.contents()) {
                    objects.add(new ObjectSummary(
                            object.key(),
                            object.size() == null ? 0L : object.size(),
                            object.lastModified(),
                            stripQuotes(object.eTag())
                    ));
                }
                truncated = Boolean.TRUE.equals(response.isTruncated());
                continuationToken = response.nextContinuationToken();
                if (!truncated || continuationToken == null) {
                    break;
                }
            }
        } catch (SdkException ex) {
            throw new StorageException("Failed to list s3://" + bucket + "/" + listPrefix, ex);
        }
        LOGGER.debug("Listed s3://{}/{}: {} prefixes, {} keys, truncated={}",
                bucket, listPrefix, commonPrefixes.size(), objects.size(), truncated);
        return new RawListing(listPrefix, commonPrefixes, objects, truncated);
    }

    @Override
    public void put(String key, byte[] content, String contentType) throws StorageException {
        try {
            PutObjectRequest.Builder request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key);
            if (contentType != null && !contentType.isBlank()) {
                request.contentType(contentType);
            }
            s3Client.putObject(request.build(), RequestBody.fromBytes(content));
            LOGGER.info("Uploaded {} bytes to s3://{}/{}", content.length, bucket, key);
        } catch (SdkException ex) {
            throw new StorageException("Failed to upload s3://" + bucket + "/" + key, ex);
        }
    }

    @Override
    public boolean exists(String key) throws StorageException {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (S3Exception ex) {
            if (ex.statusCode() == 404) {
                return false;
            }
            throw new StorageException("Failed to inspect s3://" + bucket + "/" + key, ex);
        } catch (SdkException ex) {
            throw new StorageException("Failed to inspect s3://" + bucket + "/" + key, ex);
        }
    }

    @Override
    public URL presignGet(String key, Duration expiresIn) throws StorageException {
        try {
            GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                    .signatureDuration(expiresIn)
                    .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
                    .build();
            return presigner.presignGetObject(request).url();
        } catch (SdkException ex) {
            throw new StorageException("Failed to presign s3://" + bucket + "/" + key, ex);
        }
    }

    @Override
    public void delete(String key) throws StorageException {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
            LOGGER.info("Deleted s3://{}/{}", bucket, key);
        } catch (SdkException ex) {
            throw new StorageException("Failed to delete s3://" + bucket + "/" + key, ex);
        }
    }

    @Override
    public void close() {
        try {
            presigner.close();
        } finally {
            s3Client.close();
        }
    }

    private static String stripQuotes(String etag) {
        if (etag == null) {
            return null;
        }
        return etag.replace("\"", "");
    }

    private static S3Client buildClient(Optional<String> region, Optional<URI> endpointOverride, boolean pathStyleAccess) {
        S3ClientBuilder builder = S3Client.builder()
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(pathStyleAccess).build());
        region.map(Region::of).ifPresent(builder::region);
        endpointOverride.ifPresent(builder::endpointOverride);
        return builder.build();
    }

    private static S3Presigner buildPresigner(Optional<String> region, Optional<URI> endpointOverride, boolean pathStyleAccess) {
        S3Presigner.Builder builder = S3Presigner.builder()
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(pathStyleAccess).build());
        region.map(Region::of).ifPresent(builder::region);
        endpointOverride.ifPresent(builder::endpointOverride);
        return builder.build();
    }
}
