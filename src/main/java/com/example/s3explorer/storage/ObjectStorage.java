package com.example.s3explorer.storage;

import com.example.s3explorer.StorageException;
import com.example.s3explorer.tree.RawListing;

import java.net.URL;
import java.time.Duration;

/**
 * Server-side access to the bucket. Calls run with the backend's own credentials; end-user
 * authorization happens before any of these are invoked.
 */
public interface ObjectStorage extends AutoCloseable {

    /**
     * Lists the common prefixes and direct keys under {@code prefix} using {@code delimiter},
     * returning at most {@code maxKeys} entries in backend order. A missing prefix lists as empty.
     */
    RawListing list(String prefix, String delimiter, int maxKeys) throws StorageException;

    void put(String key, byte[] content, String contentType) throws StorageException;

    /**
     * Writes a zero-length object whose key alone marks a folder.
     */
    default void putMarker(String key) throws StorageException {
        put(key, new byte[0], null);
    }

    boolean exists(String key) throws StorageException;

    /**
     * Issues a time-limited GET URL for {@code key}. Does not check that the key exists.
     */
    URL presignGet(String key, Duration expiresIn) throws StorageException;

    /**
     * Removes {@code key}; deleting a missing key is not an error.
     */
    void delete(String key) throws StorageException;

    @Override
    default void close() {
        // no-op
    }
}
