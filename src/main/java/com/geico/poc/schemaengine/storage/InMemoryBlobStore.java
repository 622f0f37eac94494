package com.geico.poc.schemaengine.storage;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local blob store. Contents are lost on restart.
 */
public class InMemoryBlobStore implements BlobStore {

    private final Map<String, String> map = new ConcurrentHashMap<>();

    @Override
    public void put(String key, String content) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(content, "content");
        map.put(BlobStore.normalize(key), content);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(map.get(BlobStore.normalize(key)));
    }

    @Override
    public boolean delete(String key) {
        return map.remove(BlobStore.normalize(key)) != null;
    }

    @Override
    public void deletePrefix(String prefix) {
        final String p = BlobStore.normalize(prefix);
        map.keySet().removeIf(k -> k.startsWith(p));
    }

    @Override
    public List<String> list(String prefix) {
        final String p = BlobStore.normalize(prefix);
        return map.keySet().stream().filter(k -> k.startsWith(p)).sorted().toList();
    }

    public int size() {
        return map.size();
    }
}
