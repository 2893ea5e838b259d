package com.example.thumbgen_backend.service;

import com.example.thumbgen_backend.exception.StorageException;
import com.example.thumbgen_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File-system backed storage; objects live under {@code baseDir}. Keys may not escape it.
 */
public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path baseDir;
    private final String publicBaseUrl;

    public LocalStorageService(Path baseDir, String publicBaseUrl) {
        if (publicBaseUrl == null || publicBaseUrl.isBlank()) {
            throw new IllegalArgumentException("storage.local.public-base-url is required");
        }
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.trim().replaceAll("/+$", "");
        try {
            Files.createDirectories(this.baseDir);
            LOGGER.info("STORAGE ready base={}", this.baseDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory", e);
        }
    }

    @Override
    public void put(String objectKey, byte[] bytes, String contentType) {
        Path target = safeResolve(objectKey);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
        } catch (IOException e) {
            throw new StorageException("Write failed: " + objectKey, e);
        }
    }

    @Override
    public byte[] get(String objectKey) {
        Path source = safeResolve(objectKey);
        if (!Files.exists(source)) {
            throw new StorageException("Object not found: " + objectKey);
        }
        try {
            return Files.readAllBytes(source);
        } catch (IOException e) {
            throw new StorageException("Read failed: " + objectKey, e);
        }
    }

    @Override
    public void delete(String objectKey) {
        Path p = safeResolve(objectKey);
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }

    @Override
    public String publicUrl(String objectKey) {
        return publicBaseUrl + "/" + baseDir.relativize(safeResolve(objectKey)).toString().replace('\\', '/');
    }

    private Path safeResolve(String objectKey) {
        Path p = baseDir.resolve(normalizeKey(objectKey)).normalize();
        if (!p.startsWith(baseDir)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    private static String normalizeKey(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        // Force forward slashes; strip leading slashes
        return objectKey.replace('\\', '/').replaceAll("^/+", "");
    }
}
