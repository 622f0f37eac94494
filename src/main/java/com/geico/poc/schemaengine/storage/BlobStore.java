package com.geico.poc.schemaengine.storage;

import java.util.List;
import java.util.Optional;

/**
 * Key/value object storage for snapshot payloads.
 * Keys are slash-separated paths; a leading slash is ignored.
 */
public interface BlobStore {

    void put(String key, String content);

    Optional<String> get(String key);

    /**
     * @return true if the key existed
     */
    boolean delete(String key);

    void deletePrefix(String prefix);

    /**
     * All keys under the prefix, sorted
     */
    List<String> list(String prefix);

    static String normalize(String key) {
        return key.startsWith("/") ? key.substring(1) : key;
    }
}
