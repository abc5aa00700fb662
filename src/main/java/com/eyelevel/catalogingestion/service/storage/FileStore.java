package com.eyelevel.catalogingestion.service.storage;

import com.eyelevel.catalogingestion.exception.FileStoreException;

import java.io.InputStream;
import java.util.List;

/**
 * Object storage for uploaded catalogs and extracted images. Keys are slash separated, e.g.
 * {@code uploads/<uploadId>_catalog.pdf} or {@code images/<uploadId>/page1_img0.png}.
 * <p>
 * File writes are not atomic with staging-row writes, so files can outlive their metadata; the
 * cleanup service's orphan sweep relies on {@link #listKeys(String)} to find them.
 */
public interface FileStore {

    String UPLOADS_PREFIX = "uploads/";
    String IMAGES_PREFIX = "images/";

    /**
     * Writes the stream to {@code key}, replacing any existing object.
     *
     * @throws FileStoreException if the object cannot be written.
     */
    void store(String key, InputStream content, long contentLength);

    void store(String key, byte[] content);

    /**
     * Opens the object for reading. The caller closes the stream.
     *
     * @throws FileStoreException if the object is missing or unreadable.
     */
    InputStream open(String key);

    boolean exists(String key);

    /**
     * @return {@code true} if an object was removed, {@code false} if none existed.
     */
    boolean delete(String key);

    /**
     * Removes every object whose key starts with {@code prefix}.
     *
     * @return number of objects removed.
     */
    int deletePrefix(String prefix);

    /**
     * Lists every key under {@code prefix}, recursively.
     */
    List<String> listKeys(String prefix);

    static String uploadKey(String uploadId, String filename) {
        return UPLOADS_PREFIX + uploadId + "_" + filename;
    }

    static String imagePrefix(String uploadId) {
        return IMAGES_PREFIX + uploadId + "/";
    }
}
