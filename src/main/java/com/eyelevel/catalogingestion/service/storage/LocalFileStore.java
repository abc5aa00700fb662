package com.eyelevel.catalogingestion.service.storage;

import com.eyelevel.catalogingestion.config.CatalogIngestionConfig;
import com.eyelevel.catalogingestion.exception.FileStoreException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * {@link FileStore} on the local filesystem, rooted at {@code app.ingestion.storage.local-root}.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.ingestion.storage", name = "type", havingValue = "local", matchIfMissing = true)
public class LocalFileStore implements FileStore {

    private final Path root;

    @Autowired
    public LocalFileStore(final CatalogIngestionConfig config) {
        this(Path.of(config.getStorage().getLocalRoot()));
    }

    public LocalFileStore(final Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new FileStoreException("Cannot create file store root " + this.root, e);
        }
        log.info("LocalFileStore initialized at '{}'.", this.root);
    }

    @Override
    @Retryable(retryFor = FileStoreException.class,
            maxAttemptsExpression = "#{${app.ingestion.storage.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.ingestion.storage.retry.delay-ms:500}}"),
            listeners = {"fileStoreRetryListener"})
    public void store(final String key, final InputStream content, final long contentLength) {
        final Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            final long written = Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored {} bytes (expected {}) at '{}'.", written, contentLength, key);
        } catch (IOException e) {
            throw new FileStoreException("Failed to store object " + key, e);
        }
    }

    @Override
    @Retryable(retryFor = FileStoreException.class,
            maxAttemptsExpression = "#{${app.ingestion.storage.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.ingestion.storage.retry.delay-ms:500}}"),
            listeners = {"fileStoreRetryListener"})
    public void store(final String key, final byte[] content) {
        store(key, new ByteArrayInputStream(content), content.length);
    }

    @Override
    public InputStream open(final String key) {
        try {
            return Files.newInputStream(resolve(key));
        } catch (IOException e) {
            throw new FileStoreException("Failed to open object " + key, e);
        }
    }

    @Override
    public boolean exists(final String key) {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public boolean delete(final String key) {
        try {
            return Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new FileStoreException("Failed to delete object " + key, e);
        }
    }

    @Override
    public int deletePrefix(final String prefix) {
        final List<String> keys = listKeys(prefix);
        int deleted = 0;
        for (String key : keys) {
            if (delete(key)) {
                deleted++;
            }
        }
        final Path directory = resolve(prefix);
        if (prefix.endsWith("/") && Files.isDirectory(directory)) {
            try {
                FileUtils.deleteDirectory(directory.toFile());
            } catch (IOException e) {
                throw new FileStoreException("Failed to delete directory " + prefix, e);
            }
        }
        return deleted;
    }

    @Override
    public List<String> listKeys(final String prefix) {
        final Path base = resolve(prefix.endsWith("/") ? prefix : FilenameUtils.getPath(prefix));
        if (!Files.isDirectory(base)) {
            return Collections.emptyList();
        }
        final Collection<File> files = FileUtils.listFiles(base.toFile(), null, true);
        return files.stream()
                    .map(file -> FilenameUtils.separatorsToUnix(root.relativize(file.toPath().toAbsolutePath()).toString()))
                    .filter(key -> key.startsWith(prefix))
                    .sorted()
                    .toList();
    }

    private Path resolve(final String key) {
        final Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new FileStoreException("Key escapes the file store root: " + key, null);
        }
        return resolved;
    }
}
