package com.photohunt.storage;

import com.photohunt.config.PhotoHuntProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

@Component
public class S3BlobStoreGateway implements BlobStoreGateway {

    private static final Logger log = LoggerFactory.getLogger(S3BlobStoreGateway.class);

    /**
     * Error codes returned when a bucket refuses the requested object ACL.
     */
    static final Set<String> ACL_REJECTION_ERROR_CODES = Set.of(
            "AccessDenied",
            "AccessControlListNotSupported",
            "AllAccessDisabled",
            "InvalidBucketAclWithObjectOwnership"
    );

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final PhotoHuntProperties.Storage storage;

    public S3BlobStoreGateway(S3Client s3Client, S3Presigner s3Presigner, PhotoHuntProperties photoHuntProperties) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.storage = photoHuntProperties.storage();
    }

    @Override
    public StorageUploadResult upload(byte[] payload, String folder, String extension) {
        if (payload == null) {
            return StorageUploadResult.failed(new IllegalArgumentException("payload is required"));
        }
        if (!StringUtils.hasText(storage.bucket())) {
            return StorageUploadResult.failed(new IllegalStateException("photohunt.storage.bucket is not configured"));
        }

        String normalizedExtension = extension.toLowerCase(Locale.ROOT);
        String key = folder + "/" + UUID.randomUUID() + "." + normalizedExtension;
        String contentType = "image/" + ("jpg".equals(normalizedExtension) ? "jpeg" : normalizedExtension);
        ObjectCannedACL acl = resolveAcl();

        try {
            putObject(key, contentType, acl, payload);
        } catch (S3Exception ex) {
            if (acl == null || !isAclRejection(ex)) {
                log.error("Upload of {} to bucket {} failed", key, storage.bucket(), ex);
                return StorageUploadResult.failed(ex);
            }
            log.warn(
                    "Bucket {} rejected ACL {} for {} ({}); retrying without ACL",
                    storage.bucket(),
                    acl,
                    key,
                    ex.awsErrorDetails().errorCode()
            );
            try {
                putObject(key, contentType, null, payload);
            } catch (SdkException retryEx) {
                log.error("Upload of {} without ACL failed", key, retryEx);
                return StorageUploadResult.failed(retryEx);
            }
        } catch (SdkException ex) {
            log.error("Upload of {} to bucket {} failed", key, storage.bucket(), ex);
            return StorageUploadResult.failed(ex);
        }

        return StorageUploadResult.uploaded(publicUrl(key));
    }

    @Override
    public String presign(String key, int ttlSeconds) {
        GetObjectRequest getObjectRequest = GetObjectRequest.builder()
                .bucket(storage.bucket())
                .key(key)
                .build();
        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(Duration.ofSeconds(ttlSeconds))
                .getObjectRequest(getObjectRequest)
                .build();
        return s3Presigner.presignGetObject(presignRequest).url().toString();
    }

    @Override
    public String extractKey(String url) {
        if (!StringUtils.hasText(url) || !(url.startsWith("http://") || url.startsWith("https://"))) {
            return null;
        }

        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException ex) {
            log.debug("Ignoring malformed storage URL {}", url);
            return null;
        }

        String host = uri.getHost();
        String path = uri.getPath();
        if (host == null || path == null || path.length() <= 1) {
            return null;
        }

        String key = path.substring(1);
        if (host.equalsIgnoreCase(storage.resolvedDomain()) || isVirtualHostedBucket(host)) {
            return key;
        }
        if (isPathStyleHost(host) && key.startsWith(storage.bucket() + "/")) {
            return key.substring(storage.bucket().length() + 1);
        }
        return null;
    }

    @Override
    public boolean delete(String key) {
        if (!StringUtils.hasText(key)) {
            return false;
        }
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(storage.bucket())
                    .key(key)
                    .build());
            return true;
        } catch (SdkException ex) {
            log.warn("Delete of {} from bucket {} failed", key, storage.bucket(), ex);
            return false;
        }
    }

    private void putObject(String key, String contentType, ObjectCannedACL acl, byte[] payload) {
        PutObjectRequest.Builder request = PutObjectRequest.builder()
                .bucket(storage.bucket())
                .key(key)
                .contentType(contentType)
                .contentLength((long) payload.length);
        if (acl != null) {
            request.acl(acl);
        }
        // A RequestBody is consumed once; each attempt gets its own copy of the buffered bytes.
        s3Client.putObject(request.build(), RequestBody.fromBytes(payload));
    }

    private ObjectCannedACL resolveAcl() {
        if (!StringUtils.hasText(storage.defaultAcl())) {
            return null;
        }
        ObjectCannedACL acl = ObjectCannedACL.fromValue(storage.defaultAcl().trim());
        if (acl == ObjectCannedACL.UNKNOWN_TO_SDK_VERSION) {
            log.warn("Unknown ACL '{}' configured; uploading without ACL", storage.defaultAcl());
            return null;
        }
        return acl;
    }

    private static boolean isAclRejection(S3Exception ex) {
        return ex.awsErrorDetails() != null
                && ACL_REJECTION_ERROR_CODES.contains(ex.awsErrorDetails().errorCode());
    }

    private String publicUrl(String key) {
        return "https://" + storage.resolvedDomain() + "/" + key;
    }

    private boolean isVirtualHostedBucket(String host) {
        String bucket = storage.bucket();
        return StringUtils.hasText(bucket)
                && host.toLowerCase(Locale.ROOT).startsWith(bucket.toLowerCase(Locale.ROOT) + ".s3");
    }

    private boolean isPathStyleHost(String host) {
        if (!StringUtils.hasText(storage.bucket())) {
            return false;
        }
        if (StringUtils.hasText(storage.endpoint())) {
            String endpointHost = URI.create(storage.endpoint().trim()).getHost();
            if (host.equalsIgnoreCase(endpointHost)) {
                return true;
            }
        }
        return host.toLowerCase(Locale.ROOT).startsWith("s3.") || host.toLowerCase(Locale.ROOT).startsWith("s3-");
    }
}
