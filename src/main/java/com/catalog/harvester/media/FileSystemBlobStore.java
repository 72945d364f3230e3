package com.catalog.harvester.media;

import com.catalog.harvester.config.StorageProperties;
import com.catalog.harvester.exception.HarvestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * {@link BlobStore} backed by a directory on the local file system ({@code storage.root}).
 */
@Slf4j
@Component
public class FileSystemBlobStore implements BlobStore {

    private final Path root;

    @Autowired
    public FileSystemBlobStore(final StorageProperties props) {
        this(Paths.get(props.getRoot()));
    }

    public FileSystemBlobStore(final Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String put(final String key, final byte[] bytes) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
        } catch (IOException ex) {
            throw new HarvestException("Cannot write blob " + key + ": " + ex.getMessage(), ex);
        }
        log.debug("Stored {} bytes at {}", bytes.length, target);
        return key;
    }

    @Override
    public Optional<byte[]> get(final String key) {
        Path target = resolve(key);
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(target));
        } catch (IOException ex) {
            throw new HarvestException("Cannot read blob " + key + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean exists(final String key) {
        return Files.isRegularFile(resolve(key));
    }

    private Path resolve(final String key) {
        Path target = root.resolve(key.replace('\\', '/')).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new HarvestException("Blob key escapes the storage root: " + key);
        }
        return target;
    }
}
