package com.photohunt.storage;

import com.photohunt.config.PhotoHuntProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;

/**
 * Writes images under the media root when the object store is unavailable and hands
 * back a site-relative URL under the media URL prefix.
 */
@Component
public class LocalMediaStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalMediaStorage.class);

    private final Path root;
    private final String urlPrefix;

    public LocalMediaStorage(PhotoHuntProperties photoHuntProperties) {
        this.root = Path.of(photoHuntProperties.media().root()).toAbsolutePath().normalize();
        this.urlPrefix = photoHuntProperties.media().normalizedUrlPrefix();
    }

    public String store(byte[] payload, String folder, String extension) throws IOException {
        String filename = UUID.randomUUID() + "." + extension.toLowerCase(Locale.ROOT);
        Path directory = root.resolve(folder).normalize();
        if (!directory.startsWith(root)) {
            throw new IOException("Folder escapes media root: " + folder);
        }
        Files.createDirectories(directory);
        Files.write(directory.resolve(filename), payload);
        return urlPrefix + folder + "/" + filename;
    }

    public boolean isLocal(String url) {
        return StringUtils.hasText(url) && url.startsWith(urlPrefix);
    }

    /**
     * Best-effort delete of a file previously returned by {@link #store}.
     */
    public boolean delete(String url) {
        if (!isLocal(url)) {
            return false;
        }
        Path file = root.resolve(url.substring(urlPrefix.length())).normalize();
        if (!file.startsWith(root)) {
            log.warn("Refusing to delete {} outside media root", url);
            return false;
        }
        try {
            return Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Delete of local media {} failed", url, ex);
            return false;
        }
    }
}
