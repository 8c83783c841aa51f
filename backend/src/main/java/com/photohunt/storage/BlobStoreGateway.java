package com.photohunt.storage;

/**
 * Durable object storage for photo hunt images.
 */
public interface BlobStoreGateway {

    /**
     * Stores the payload under {@code folder} with a generated name and the given extension.
     */
    StorageUploadResult upload(byte[] payload, String folder, String extension);

    /**
     * Time-limited GET URL for an object key.
     */
    String presign(String key, int ttlSeconds);

    /**
     * Object key behind a public or presigned URL of this store, or {@code null} when the
     * URL does not point into the store.
     */
    String extractKey(String url);

    /**
     * Best-effort delete. Never throws; returns whether the store accepted the delete.
     */
    boolean delete(String key);
}
