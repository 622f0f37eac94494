package com.geico.poc.schemaengine.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Blob store keeping one file per key under a root directory.
 * Writes go to a sibling temp file first and are moved into place.
 */
public class FileSystemBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);

    private final Path root;

    public FileSystemBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create blob root " + this.root, e);
        }
        log.info("📋 File system blob store at {}", this.root);
    }

    @Override
    public void put(String key, String content) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new BlobStorageException(BlobStorageException.msg("fs", "PUT", key, e.getMessage()), e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        Path target = resolve(key);
        try {
            return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new BlobStorageException(BlobStorageException.msg("fs", "GET", key, e.getMessage()), e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new BlobStorageException(BlobStorageException.msg("fs", "DELETE", key, e.getMessage()), e);
        }
    }

    @Override
    public void deletePrefix(String prefix) {
        for (String key : list(prefix)) {
            delete(key);
        }
    }

    @Override
    public List<String> list(String prefix) {
        final String p = BlobStore.normalize(prefix);
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                .filter(Files::isRegularFile)
                .filter(f -> !f.getFileName().toString().endsWith(".tmp"))
                .map(f -> root.relativize(f).toString().replace('\\', '/'))
                .filter(k -> k.startsWith(p))
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new BlobStorageException(BlobStorageException.msg("fs", "LIST", prefix, e.getMessage()), e);
        }
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(String key) {
        Path path = root.resolve(BlobStore.normalize(key)).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new BlobStorageException(BlobStorageException.msg("fs", "RESOLVE", key, "key escapes blob root"));
        }
        return path;
    }
}
