package com.photohunt.storage;

import java.util.Objects;

/**
 * Outcome of one upload: either the durable URL of the stored object or the failure
 * that prevented it. The caller decides how to fall back.
 */
public record StorageUploadResult(
        String url,
        Exception failure
) {
    public StorageUploadResult {
        if ((url == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of url or failure is required");
        }
    }

    public static StorageUploadResult uploaded(String url) {
        return new StorageUploadResult(Objects.requireNonNull(url, "url is required"), null);
    }

    public static StorageUploadResult failed(Exception failure) {
        return new StorageUploadResult(null, Objects.requireNonNull(failure, "failure is required"));
    }

    public boolean isUploaded() {
        return url != null;
    }
}
