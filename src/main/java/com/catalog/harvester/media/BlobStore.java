package com.catalog.harvester.media;

import java.util.Optional;

/**
 * Key/value store for binary assets such as downloaded product images.
 * Keys are relative, slash-separated paths.
 */
public interface BlobStore {

    /**
     * Stores the bytes under the key, replacing any previous content.
     *
     * @return the key the content was stored under
     */
    String put(String key, byte[] bytes);

    Optional<byte[]> get(String key);

    boolean exists(String key);
}
