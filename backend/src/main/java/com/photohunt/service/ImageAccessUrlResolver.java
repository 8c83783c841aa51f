package com.photohunt.service;

import com.photohunt.config.PhotoHuntProperties;
import com.photohunt.storage.BlobStoreGateway;
import com.photohunt.storage.LocalMediaStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns a durable image reference into a URL the comparator can fetch: a short-lived
 * presigned URL for objects in the store, an absolute URL for local media.
 */
@Component
public class ImageAccessUrlResolver {

    private static final Logger log = LoggerFactory.getLogger(ImageAccessUrlResolver.class);

    private final BlobStoreGateway blobStoreGateway;
    private final LocalMediaStorage localMediaStorage;
    private final PhotoHuntProperties photoHuntProperties;

    public ImageAccessUrlResolver(
            BlobStoreGateway blobStoreGateway,
            LocalMediaStorage localMediaStorage,
            PhotoHuntProperties photoHuntProperties
    ) {
        this.blobStoreGateway = blobStoreGateway;
        this.localMediaStorage = localMediaStorage;
        this.photoHuntProperties = photoHuntProperties;
    }

    /**
     * @return a fetchable URL, or {@code null} when the reference cannot be fetched remotely
     */
    public String resolve(String storedReference) {
        if (!StringUtils.hasText(storedReference)) {
            return null;
        }
        String reference = storedReference.trim();

        if (reference.startsWith("http://") || reference.startsWith("https://")) {
            String key = blobStoreGateway.extractKey(reference);
            if (key == null) {
                return reference;
            }
            try {
                return blobStoreGateway.presign(key, photoHuntProperties.storage().presignTtlSeconds());
            } catch (RuntimeException ex) {
                log.warn("Presigning {} failed; handing the comparator the stored URL", key, ex);
                return reference;
            }
        }

        String publicBaseUrl = photoHuntProperties.media().publicBaseUrl();
        if (!localMediaStorage.isLocal(reference) && !reference.startsWith("/")) {
            return null;
        }
        if (!StringUtils.hasText(publicBaseUrl)) {
            return null;
        }
        String base = publicBaseUrl.trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + (reference.startsWith("/") ? reference : "/" + reference);
    }
}
